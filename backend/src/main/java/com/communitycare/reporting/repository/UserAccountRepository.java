package com.communitycare.reporting.repository;

import com.communitycare.reporting.model.UserAccount;
import com.communitycare.reporting.model.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {
    Optional<UserAccount> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByUsernameIgnoreCase(String username);

    boolean existsByRole(UserRole role);

    List<UserAccount> findAllByOrderByIdDesc();
}
