package com.docspace.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.docspace.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    @Query("""
            select u from AppUser u
            join fetch u.department
            where u.id = :userId
            """)
    Optional<AppUser> findWithDepartmentById(@Param("userId") UUID userId);

    @Query("""
            select distinct p.name from AppUser u
            join u.department d
            join d.permissions p
            where u.id = :userId
              and d.active = true
              and p.active = true
            order by p.name
            """)
    List<String> findPermissionNames(@Param("userId") UUID userId);
}
