package com.secretgateway.gateway.http;

import com.secretgateway.token.IssueRequest;
import com.secretgateway.token.IssuedToken;
import com.secretgateway.token.TokenService;
import com.secretgateway.token.ValidationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/tokens")
public class TokenController {

    private final TokenService tokenService;

    public TokenController(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @PostMapping("/issue")
    public ResponseEntity<IssuedToken> issue(@RequestBody IssueRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tokenService.issue(request));
    }

    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody ValidateRequest request) {
        return tokenService.validate(request.tokenId());
    }

    @DeleteMapping("/{tokenId}")
    public ResponseEntity<Map<String, String>> revoke(@PathVariable String tokenId) {
        if (tokenService.revoke(tokenId)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Token not found"));
    }

    @GetMapping("/stats")
    public Map<String, Integer> stats() {
        return Map.of("active_tokens", tokenService.activeCount());
    }

    @PostMapping("/cleanup")
    public Map<String, Integer> cleanup() {
        return Map.of("removed_tokens", tokenService.cleanup());
    }
}
