package com.analyticscache.infrastructure.persistence;

import com.analyticscache.domain.model.DataSourceConfig;
import com.analyticscache.domain.model.DataSourceType;
import com.analyticscache.domain.service.DataSourceConfigProvider;
import com.analyticscache.infrastructure.persistence.entity.DataSourceColumnEntity;
import com.analyticscache.infrastructure.persistence.entity.DataSourceEntity;
import com.analyticscache.infrastructure.persistence.repository.DataSourceColumnRepository;
import com.analyticscache.infrastructure.persistence.repository.DataSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Data-source configuration read from chart_data_sources and chart_data_source_columns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaDataSourceConfigProvider implements DataSourceConfigProvider {

    static final String DEFAULT_TIME_PERIOD_COLUMN = "frequency";
    static final String DEFAULT_DATE_COLUMN = "date_index";

    private final DataSourceRepository dataSourceRepository;
    private final DataSourceColumnRepository columnRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DataSourceConfig> findById(int dataSourceId) {
        return dataSourceRepository.findById(dataSourceId)
                .map(entity -> toConfig(entity, columnRepository.findRoleColumns(List.of(dataSourceId))));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DataSourceConfig> findActive() {
        List<DataSourceEntity> entities = dataSourceRepository.findByActiveTrueOrderByDataSourceIdAsc();
        if (entities.isEmpty()) {
            return List.of();
        }

        List<Integer> ids = entities.stream().map(DataSourceEntity::getDataSourceId).collect(Collectors.toList());
        Map<Integer, List<DataSourceColumnEntity>> columnsBySource = columnRepository.findRoleColumns(ids).stream()
                .collect(Collectors.groupingBy(DataSourceColumnEntity::getDataSourceId));

        return entities.stream()
                .map(entity -> toConfig(entity, columnsBySource.getOrDefault(entity.getDataSourceId(), List.of())))
                .collect(Collectors.toList());
    }

    private DataSourceConfig toConfig(DataSourceEntity entity, List<DataSourceColumnEntity> columns) {
        String timePeriodColumn = columns.stream()
                .filter(column -> Boolean.TRUE.equals(column.getTimePeriod()))
                .map(DataSourceColumnEntity::getColumnName)
                .findFirst()
                .orElse(DEFAULT_TIME_PERIOD_COLUMN);

        // date_index wins when several columns are flagged as dates
        List<String> dateColumns = columns.stream()
                .filter(column -> Boolean.TRUE.equals(column.getDateField()))
                .map(DataSourceColumnEntity::getColumnName)
                .collect(Collectors.toList());
        String dateColumn = dateColumns.contains(DEFAULT_DATE_COLUMN) || dateColumns.isEmpty()
                ? DEFAULT_DATE_COLUMN
                : dateColumns.get(0);

        return DataSourceConfig.builder()
                .dataSourceId(entity.getDataSourceId())
                .name(entity.getName())
                .schemaName(entity.getSchemaName())
                .tableName(entity.getTableName())
                .type(resolveType(entity))
                .timePeriodColumn(timePeriodColumn)
                .dateColumn(dateColumn)
                .active(Boolean.TRUE.equals(entity.getActive()))
                .build();
    }

    private DataSourceType resolveType(DataSourceEntity entity) {
        try {
            return DataSourceType.fromCode(entity.getDataSourceType());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown data source type, defaulting to measure-based: dataSourceId={}, type={}",
                    entity.getDataSourceId(), entity.getDataSourceType());
            return DataSourceType.MEASURE_BASED;
        }
    }
}
