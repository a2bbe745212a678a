package com.docspace.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.docspace.backend.modules.auth.domain.Department;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DepartmentRepository extends JpaRepository<Department, UUID> {

    Optional<Department> findByIdAndActiveTrue(UUID id);
}
