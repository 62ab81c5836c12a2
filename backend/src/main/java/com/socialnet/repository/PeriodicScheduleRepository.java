package com.socialnet.repository;

import com.socialnet.entity.PeriodicSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for PeriodicSchedule entity.
 */
@Repository
public interface PeriodicScheduleRepository extends JpaRepository<PeriodicSchedule, Long> {

    Optional<PeriodicSchedule> findByName(String name);

    boolean existsByName(String name);

    List<PeriodicSchedule> findByEnabledTrueOrderByNameAsc();

    List<PeriodicSchedule> findAllByOrderByNameAsc();
}
