package com.nectarstudio.realtime.repository;

import com.nectarstudio.realtime.model.domain.JobCursor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobCursorRepository extends JpaRepository<JobCursor, String> {

    /**
     * All cursors recorded for one monitored table, across filter sets.
     */
    List<JobCursor> findByServiceNameAndEntityName(String serviceName, String entityName);
}
