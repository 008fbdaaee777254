package com.mingle.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.mingle.backend.modules.auth.domain.MingleUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MingleUserRepository extends JpaRepository<MingleUser, UUID> {

    @Query("select u from MingleUser u where lower(u.email) = lower(:email)")
    Optional<MingleUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(u) > 0 then true else false end from MingleUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);
}
