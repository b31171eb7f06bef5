package com.studentregistry.backend.api;

import com.studentregistry.backend.config.StudentApiProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final StudentApiProperties props;

    public HealthController(StudentApiProperties props) {
        this.props = props;
    }

    @GetMapping("/")
    public Map<String, Object> health() {
        return Map.of(
                "status", "running",
                "version", props.version()
        );
    }
}
