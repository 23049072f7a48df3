package com.libauto.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AutomationJobRepository extends JpaRepository<AutomationJob, String> {

    List<AutomationJob> findByEnabledTrueOrderByNameAsc();

    List<AutomationJob> findAllByOrderByNameAsc();

    Optional<AutomationJob> findByName(String name);
}
