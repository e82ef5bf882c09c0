package com.example.accesslog.http;

import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.RemoteOrigins;
import com.example.accesslog.service.CooldownService;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CooldownController {

    private final CooldownService cooldownService;

    public CooldownController(CooldownService cooldownService) {
        this.cooldownService = cooldownService;
    }

    @GetMapping("/cooldown")
    public ResponseEntity<Map<String, Object>> cooldown(
            @RequestParam String scope,
            @RequestParam long amount,
            @RequestParam long period,
            @RequestParam(value = "remote_origin", required = false) String remoteOrigin,
            @RequestParam(value = "subject_id", required = false) String subjectId
    ) {
        boolean cooldown = cooldownService.cooldown(
                scope,
                amount,
                period,
                Optional.ofNullable(remoteOrigin).filter(s -> !s.isBlank()).map(RemoteOrigins::parse),
                Optional.ofNullable(subjectId).filter(s -> !s.isBlank()).map(Identifier::parse)
        );
        return ResponseEntity.ok(Map.of("cooldown", cooldown));
    }
}
