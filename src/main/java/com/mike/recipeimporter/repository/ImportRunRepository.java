package com.mike.recipeimporter.repository;

import com.mike.recipeimporter.entity.ImportRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ImportRunRepository extends JpaRepository<ImportRun, Long> {

    Optional<ImportRun> findTopByOrderByStartedAtDescIdDesc();
}
