package com.communitycare.reporting.auth;

import com.communitycare.reporting.dto.UserDTO;
import com.communitycare.reporting.service.UserManagementService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@CrossOrigin(origins = "*")
public class AuthController {

    private final UserManagementService userService;
    private final ActorResolver actorResolver;

    public AuthController(UserManagementService userService, ActorResolver actorResolver) {
        this.userService = userService;
        this.actorResolver = actorResolver;
    }

    @PostMapping("/register")
    public ResponseEntity<UserDTO> register(@RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(request));
    }

    // Session handling lives in front of this service; the client sends the returned id as X-User-Id
    @PostMapping("/login")
    public UserDTO login(@RequestBody(required = false) LoginRequest request) {
        if (request == null) {
            return userService.authenticate(null, null);
        }
        return userService.authenticate(request.getEmail(), request.getPassword());
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        userService.logout(actorResolver.resolve(userId));
        return ResponseEntity.noContent().build();
    }
}
