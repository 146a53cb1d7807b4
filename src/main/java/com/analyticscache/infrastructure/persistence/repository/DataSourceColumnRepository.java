package com.analyticscache.infrastructure.persistence.repository;

import com.analyticscache.infrastructure.persistence.entity.DataSourceColumnEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Column flags that decide how a data source's rows are grouped and date-filtered.
 */
@Repository
public interface DataSourceColumnRepository extends JpaRepository<DataSourceColumnEntity, Integer> {

    /**
     * Active time-period and date columns of the given data sources, one round trip for warm-all.
     */
    @Query("SELECT c FROM DataSourceColumnEntity c WHERE " +
           "c.dataSourceId IN :dataSourceIds AND c.active = true AND " +
           "(c.timePeriod = true OR c.dateField = true) " +
           "ORDER BY c.dataSourceId ASC, c.sortOrder ASC, c.columnId ASC")
    List<DataSourceColumnEntity> findRoleColumns(@Param("dataSourceIds") Collection<Integer> dataSourceIds);
}
