package com.analyticscache.infrastructure.persistence.repository;

import com.analyticscache.infrastructure.persistence.entity.DataSourceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DataSourceRepository extends JpaRepository<DataSourceEntity, Integer> {

    List<DataSourceEntity> findByActiveTrueOrderByDataSourceIdAsc();
}
