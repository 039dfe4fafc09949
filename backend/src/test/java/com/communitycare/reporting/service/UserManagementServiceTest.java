package com.communitycare.reporting.service;

import com.communitycare.reporting.auth.Actor;
import com.communitycare.reporting.auth.RegisterRequest;
import com.communitycare.reporting.dto.UserDTO;
import com.communitycare.reporting.exception.ConflictException;
import com.communitycare.reporting.exception.ForbiddenException;
import com.communitycare.reporting.exception.NotFoundException;
import com.communitycare.reporting.exception.UnauthorizedException;
import com.communitycare.reporting.exception.ValidationException;
import com.communitycare.reporting.model.AuditAction;
import com.communitycare.reporting.model.AuditTargetType;
import com.communitycare.reporting.model.UserAccount;
import com.communitycare.reporting.model.UserRole;
import com.communitycare.reporting.repository.AdminLogRepository;
import com.communitycare.reporting.repository.NotificationRepository;
import com.communitycare.reporting.repository.ReportRepository;
import com.communitycare.reporting.repository.UserAccountRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserManagementServiceTest {

    @Mock private UserAccountRepository userRepository;
    @Mock private ReportRepository reportRepository;
    @Mock private NotificationRepository notificationRepository;
    @Mock private AdminLogRepository adminLogRepository;
    @Mock private AuditLogService auditLogService;
    @Mock private PasswordEncoder passwordEncoder;

    private UserManagementService service;

    private final Actor admin = new Actor(9L, UserRole.ADMIN);

    @BeforeEach
    void setUp() {
        service = new UserManagementService(userRepository, reportRepository, notificationRepository,
                adminLogRepository, auditLogService, passwordEncoder);
    }

    private static ValidationException validationOf(Runnable call) {
        try {
            call.run();
        } catch (ValidationException e) {
            return e;
        }
        throw new AssertionError("Expected ValidationException");
    }

    @Test
    void registerCreatesRegularUserWithHashedPassword() {
        when(userRepository.existsByEmail("bob@example.com")).thenReturn(false);
        when(userRepository.existsByUsernameIgnoreCase("bob")).thenReturn(false);
        when(passwordEncoder.encode("secret1")).thenReturn("HASH");
        when(userRepository.saveAndFlush(any(UserAccount.class))).thenAnswer(inv -> {
            UserAccount u = inv.getArgument(0);
            u.setId(3L);
            return u;
        });

        UserDTO dto = service.register(new RegisterRequest("bob", " Bob@Example.com ", "secret1", "secret1", "+254712345678"));

        assertThat(dto.getId()).isEqualTo(3L);
        assertThat(dto.getEmail()).isEqualTo("bob@example.com");
        assertThat(dto.getRole()).isEqualTo("user");
        verify(userRepository).saveAndFlush(argThat(u -> "HASH".equals(u.getPasswordHash()) && u.getRole() == UserRole.USER));
    }

    @Test
    void registerValidationOrder() {
        assertThat(validationOf(() -> service.register(new RegisterRequest("bob", "not-an-email", "secret1", "secret1", null))).getField())
                .isEqualTo("email");
        assertThat(validationOf(() -> service.register(new RegisterRequest("bob", "bob@example.com", "secret1", "secret1", "12ab"))).getField())
                .isEqualTo("phone");
        ValidationException mismatch = validationOf(() -> service.register(new RegisterRequest("bob", "bob@example.com", "abc", "xyz", null)));
        assertThat(mismatch.getField()).isEqualTo("confirmPassword");
        assertThat(mismatch.getMessage()).isEqualTo("Passwords do not match");
        assertThat(validationOf(() -> service.register(new RegisterRequest("bob", "bob@example.com", "abc", "abc", null))).getField())
                .isEqualTo("password");
        verifyNoInteractions(userRepository);
    }

    @Test
    void registerDuplicateEmailIsConflict() {
        when(userRepository.existsByEmail("bob@example.com")).thenReturn(true);

        assertThatThrownBy(() -> service.register(new RegisterRequest("bob", "bob@example.com", "secret1", "secret1", null)))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Email already exists");
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    void registerRaceOnUniqueConstraintIsConflict() {
        when(passwordEncoder.encode(any())).thenReturn("HASH");
        when(userRepository.saveAndFlush(any(UserAccount.class))).thenThrow(new DataIntegrityViolationException("duplicate key",
                new ConstraintViolationException("duplicate key", new SQLException("duplicate key", "23505"), "uk_users_email")));

        assertThatThrownBy(() -> service.register(new RegisterRequest("bob", "bob@example.com", "secret1", "secret1", null)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void registerPropagatesOtherIntegrityFailures() {
        when(passwordEncoder.encode(any())).thenReturn("HASH");
        when(userRepository.saveAndFlush(any(UserAccount.class)))
                .thenThrow(new DataIntegrityViolationException("value too long for type character varying(20)"));

        assertThatThrownBy(() -> service.register(new RegisterRequest("bob", "bob@example.com", "secret1", "secret1", null)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void registerRejectsOverlongEmail() {
        String email = "a".repeat(250) + "@example.com";

        ValidationException ex = validationOf(() -> service.register(new RegisterRequest("longmail", email, "secret1", "secret1", null)));

        assertThat(ex.getField()).isEqualTo("email");
        assertThat(ex.getMessage()).isEqualTo("email must be at most 255 characters");
        verifyNoInteractions(userRepository);
    }

    @Test
    void authenticateRejectsWrongPassword() {
        UserAccount bob = new UserAccount("bob", "bob@example.com", "HASH", null, UserRole.USER);
        when(userRepository.findByEmail("bob@example.com")).thenReturn(Optional.of(bob));
        when(passwordEncoder.matches("wrong", "HASH")).thenReturn(false);

        assertThatThrownBy(() -> service.authenticate("BOB@example.com", "wrong"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid email or password");
    }

    @Test
    void logoutAuditsOnlyAdmins() {
        service.logout(new Actor(1L, UserRole.USER));
        verifyNoInteractions(auditLogService);

        service.logout(admin);
        verify(auditLogService).record(9L, AuditAction.LOGOUT, AuditTargetType.SYSTEM, null, "Admin logged out");
    }

    @Test
    void setRoleOnSelfIsForbidden() {
        assertThatThrownBy(() -> service.setRole(admin, 9L, "user"))
                .isInstanceOf(ForbiddenException.class)
                .satisfies(ex -> assertThat(((ForbiddenException) ex).getReason()).isEqualTo(ForbiddenException.Reason.SELF_MODIFICATION));
        verifyNoInteractions(userRepository, auditLogService);
    }

    @Test
    void setRoleRejectsUnknownRole() {
        ValidationException ex = validationOf(() -> service.setRole(admin, 3L, "superuser"));
        assertThat(ex.getField()).isEqualTo("role");
        verifyNoInteractions(userRepository);
    }

    @Test
    void setRolePromotesAndAudits() {
        UserAccount bob = new UserAccount("bob", "bob@example.com", "HASH", null, UserRole.USER);
        bob.setId(3L);
        when(userRepository.findById(3L)).thenReturn(Optional.of(bob));

        UserDTO dto = service.setRole(admin, 3L, "Admin");

        assertThat(dto.getRole()).isEqualTo("admin");
        verify(auditLogService).record(9L, AuditAction.UPDATE_ROLE, AuditTargetType.USER, 3L, "Role changed to admin");
    }

    @Test
    void setRoleByNonAdminIsForbidden() {
        assertThatThrownBy(() -> service.setRole(new Actor(1L, UserRole.USER), 3L, "admin"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void deleteUserCascadesAndAudits() {
        UserAccount bob = new UserAccount("bob", "bob@example.com", "HASH", null, UserRole.USER);
        bob.setId(3L);
        when(userRepository.findById(3L)).thenReturn(Optional.of(bob));
        when(reportRepository.findIdsByUserId(3L)).thenReturn(List.of(10L, 11L));
        when(reportRepository.deleteByOwner(3L)).thenReturn(2);

        service.deleteUser(admin, 3L);

        verify(notificationRepository).deleteByReportIds(List.of(10L, 11L));
        verify(notificationRepository).deleteByRecipient(3L);
        verify(adminLogRepository).detachAdmin(3L);
        verify(userRepository).deleteById(3L);
        verify(auditLogService).record(9L, AuditAction.DELETE, AuditTargetType.USER, 3L,
                "Deleted user: bob (cascade removed 2 reports)");
    }

    @Test
    void deleteUserByNonAdminIsForbidden() {
        assertThatThrownBy(() -> service.deleteUser(new Actor(1L, UserRole.USER), 3L))
                .isInstanceOf(ForbiddenException.class)
                .satisfies(ex -> assertThat(((ForbiddenException) ex).getReason()).isEqualTo(ForbiddenException.Reason.ROLE_REQUIRED));
        verifyNoInteractions(userRepository, reportRepository, notificationRepository, adminLogRepository, auditLogService);
    }

    @Test
    void deleteMissingUserIsNotFound() {
        when(userRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteUser(admin, 99L)).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(auditLogService, reportRepository);
    }
}
