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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class UserManagementService {
    private static final Logger log = LoggerFactory.getLogger(UserManagementService.class);

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern PHONE = Pattern.compile("^\\+?1?\\d{9,15}$");
    static final int MIN_PASSWORD_LENGTH = 6;
    static final int MAX_EMAIL_LENGTH = 255;
    // SQLSTATE for unique_violation (PostgreSQL and H2)
    private static final String UNIQUE_VIOLATION = "23505";

    private final UserAccountRepository userRepository;
    private final ReportRepository reportRepository;
    private final NotificationRepository notificationRepository;
    private final AdminLogRepository adminLogRepository;
    private final AuditLogService auditLogService;
    private final PasswordEncoder passwordEncoder;

    public UserManagementService(UserAccountRepository userRepository,
                                 ReportRepository reportRepository,
                                 NotificationRepository notificationRepository,
                                 AdminLogRepository adminLogRepository,
                                 AuditLogService auditLogService,
                                 PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.reportRepository = reportRepository;
        this.notificationRepository = notificationRepository;
        this.adminLogRepository = adminLogRepository;
        this.auditLogService = auditLogService;
        this.passwordEncoder = passwordEncoder;
    }

    /** Creates a regular user. Checks run in the order a registration form reports them. */
    @Transactional
    public UserDTO register(RegisterRequest req) {
        if (req == null) throw new ValidationException("request", "Registration details are required");
        String username = trimToNull(req.getUsername());
        String email = normalizeEmail(req.getEmail());
        String phone = trimToNull(req.getPhone());
        if (username == null) throw new ValidationException("username", "username is required");
        if (email == null) throw new ValidationException("email", "email is required");
        if (req.getPassword() == null || req.getPassword().isEmpty()) throw new ValidationException("password", "password is required");
        if (req.getConfirmPassword() == null || req.getConfirmPassword().isEmpty()) {
            throw new ValidationException("confirmPassword", "confirmPassword is required");
        }
        if (username.length() > 100) throw new ValidationException("username", "username must be at most 100 characters");
        if (email.length() > MAX_EMAIL_LENGTH) {
            throw new ValidationException("email", "email must be at most " + MAX_EMAIL_LENGTH + " characters");
        }
        if (!EMAIL.matcher(email).matches()) throw new ValidationException("email", "Please enter a valid email address");
        if (phone != null && !PHONE.matcher(phone).matches()) throw new ValidationException("phone", "Please enter a valid phone number");
        if (!req.getPassword().equals(req.getConfirmPassword())) throw new ValidationException("confirmPassword", "Passwords do not match");
        if (req.getPassword().length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("password", "Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }

        if (userRepository.existsByEmail(email)) throw new ConflictException("email", "Email already exists");
        if (userRepository.existsByUsernameIgnoreCase(username)) throw new ConflictException("username", "Username already exists");

        UserAccount user = new UserAccount(username, email, passwordEncoder.encode(req.getPassword()), phone, UserRole.USER);
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueViolation(e)) throw e;
            // lost a race with a concurrent registration for the same email or username
            throw new ConflictException("email", "Email or username already exists");
        }
        log.info("[USER][REGISTER] id={} username='{}'", user.getId(), username);
        return UserDTO.from(user);
    }

    public UserDTO authenticate(String email, String password) {
        String normalized = normalizeEmail(email);
        if (normalized == null || password == null) {
            throw new UnauthorizedException("Invalid email or password");
        }
        UserAccount user = userRepository.findByEmail(normalized).orElse(null);
        if (user == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            log.warn("[USER][LOGIN] rejected credentials for '{}'", normalized);
            throw new UnauthorizedException("Invalid email or password");
        }
        return UserDTO.from(user);
    }

    /** Only admin sessions leave a trace in the audit log. */
    @Transactional
    public void logout(Actor actor) {
        if (actor != null && actor.isAdmin()) {
            auditLogService.record(actor.id(), AuditAction.LOGOUT, AuditTargetType.SYSTEM, null, "Admin logged out");
        }
    }

    public List<UserDTO> listUsers(Actor actor) {
        requireAdmin(actor, "list users");
        return userRepository.findAllByOrderByIdDesc().stream().map(UserDTO::from).collect(Collectors.toList());
    }

    @Transactional
    public UserDTO setRole(Actor actor, Long userId, String newRole) {
        requireAdmin(actor, "change user roles");
        if (actor.id().equals(userId)) {
            throw new ForbiddenException(ForbiddenException.Reason.SELF_MODIFICATION, "Administrators cannot change their own role");
        }
        UserRole role = UserRole.fromLabel(newRole);
        if (role == null) throw new ValidationException("role", "role must be 'user' or 'admin'");
        UserAccount user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));

        user.setRole(role);
        userRepository.save(user);
        auditLogService.record(actor.id(), AuditAction.UPDATE_ROLE, AuditTargetType.USER, userId, "Role changed to " + role.getLabel());
        return UserDTO.from(user);
    }

    /**
     * Deletes a user together with every report they own (and the notifications tied to those reports or
     * addressed to them). Audit entries the user wrote as an admin are kept without their author.
     */
    @Transactional
    public void deleteUser(Actor actor, Long userId) {
        requireAdmin(actor, "delete users");
        if (actor.id().equals(userId)) {
            throw new ForbiddenException(ForbiddenException.Reason.SELF_MODIFICATION, "Administrators cannot delete their own account");
        }
        UserAccount user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));
        String username = user.getUsername();

        List<Long> reportIds = reportRepository.findIdsByUserId(userId);
        if (!reportIds.isEmpty()) {
            notificationRepository.deleteByReportIds(reportIds);
        }
        notificationRepository.deleteByRecipient(userId);
        int reports = reportRepository.deleteByOwner(userId);
        adminLogRepository.detachAdmin(userId);
        userRepository.deleteById(userId);

        auditLogService.record(actor.id(), AuditAction.DELETE, AuditTargetType.USER, userId,
                "Deleted user: " + username + " (cascade removed " + reports + " reports)");
        log.info("[USER][DELETE] user={} reports={} by admin={}", userId, reports, actor.id());
    }

    private static void requireAdmin(Actor actor, String operation) {
        if (actor == null) throw new UnauthorizedException("No acting user");
        if (!actor.isAdmin()) {
            log.warn("[USER] user={} attempted to {} without admin role", actor.id(), operation);
            throw ForbiddenException.adminRequired(operation);
        }
    }

    private static boolean isUniqueViolation(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve) {
                String name = cve.getConstraintName();
                return UNIQUE_VIOLATION.equals(cve.getSQLState())
                        || (name != null && name.toLowerCase(Locale.ROOT).contains("uk_users"));
            }
        }
        return false;
    }

    static String normalizeEmail(String email) {
        String e = trimToNull(email);
        return e == null ? null : e.toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
