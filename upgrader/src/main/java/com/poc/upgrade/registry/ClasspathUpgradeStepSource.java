package com.poc.upgrade.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.exception.RegistryException;
import com.poc.upgrade.infrastructure.database.Dialect;
import com.poc.upgrade.util.SqlValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads step definitions packaged as JSON resources.
 * The file name and the parent directory must agree with the versions and
 * dialect declared inside the document.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClasspathUpgradeStepSource implements UpgradeStepSource {
    
    private static final Pattern FILE_NAME = Pattern.compile("upgrade_from_(\\d+)_to_(\\d+)\\.json");
    
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final UpgradeProperties properties;
    private final ResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();
    
    @Override
    public List<UpgradeStep> loadSteps() {
        String location = properties.getSteps().getLocation();
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(location);
        } catch (IOException e) {
            throw new RegistryException("Failed to scan upgrade steps at " + location, e);
        }
        
        log.info("Found {} upgrade step definitions at {}", resources.length, location);
        
        List<UpgradeStep> steps = new ArrayList<>();
        for (Resource resource : resources) {
            steps.add(parse(resource));
        }
        return steps;
    }
    
    /**
     * Parse and cross-check a single definition.
     */
    UpgradeStep parse(Resource resource) {
        String fileName = resource.getFilename();
        Matcher matcher = FILE_NAME.matcher(fileName == null ? "" : fileName);
        if (!matcher.matches()) {
            throw new RegistryException("Unrecognised upgrade step file name: " + fileName);
        }
        
        UpgradeStepDefinition definition;
        try (InputStream in = resource.getInputStream()) {
            definition = objectMapper.readValue(in, UpgradeStepDefinition.class);
        } catch (IOException e) {
            throw new RegistryException("Failed to read upgrade step " + fileName, e);
        }
        
        Set<ConstraintViolation<UpgradeStepDefinition>> violations = validator.validate(definition);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .collect(Collectors.joining(", "));
            throw new RegistryException("Invalid upgrade step " + fileName + ": " + details);
        }
        
        int declaredFrom = definition.getFromVersion();
        int declaredTo = definition.getToVersion();
        if (Integer.parseInt(matcher.group(1)) != declaredFrom || Integer.parseInt(matcher.group(2)) != declaredTo) {
            throw new RegistryException(String.format(
                "Upgrade step %s declares versions %d -> %d", fileName, declaredFrom, declaredTo
            ));
        }
        
        UpgradeStep step;
        try {
            step = definition.toStep();
        } catch (IllegalArgumentException e) {
            throw new RegistryException("Invalid upgrade step " + fileName + ": " + e.getMessage(), e);
        }
        
        String directory = parentDirectory(resource);
        Dialect dialect = step.getDialect();
        if (directory != null && !directory.equals(dialect.getTag())) {
            throw new RegistryException(String.format(
                "Upgrade step %s declares dialect %s but is packaged under %s",
                fileName, dialect.getTypeName(), directory
            ));
        }
        
        for (BackfillSpec backfill : step.getBackfills()) {
            try {
                SqlValidator.validateIdentifier(backfill.getTable());
                SqlValidator.validateIdentifier(backfill.getResourceIdColumn());
                SqlValidator.validateIdentifier(backfill.getWorkTable());
                SqlValidator.validatePredicate(backfill.getPredicate());
            } catch (IllegalArgumentException e) {
                throw new RegistryException("Invalid backfill in " + fileName + ": " + e.getMessage(), e);
            }
        }
        
        log.debug("Loaded upgrade step {}", step.getName());
        return step;
    }
    
    private String parentDirectory(Resource resource) {
        try {
            String path = resource.getURL().getPath();
            String[] segments = path.split("/");
            return segments.length >= 2 ? segments[segments.length - 2] : null;
        } catch (IOException e) {
            log.debug("No URL for resource {}: {}", resource.getDescription(), e.getMessage());
            return null;
        }
    }
}
