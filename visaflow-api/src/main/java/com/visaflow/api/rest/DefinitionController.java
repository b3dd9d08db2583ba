package com.visaflow.api.rest;

import com.visaflow.core.exception.DefinitionNotFoundException;
import com.visaflow.core.model.WorkflowDefinition;
import com.visaflow.core.repository.WorkflowDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for workflow definitions.
 * Definitions are stored as sent; a new version with the same id replaces the previous one.
 */
@RestController
@RequestMapping("/api/v1/definitions")
public class DefinitionController {

    private static final Logger log = LoggerFactory.getLogger(DefinitionController.class);

    private final WorkflowDefinitionRepository definitionRepository;

    public DefinitionController(WorkflowDefinitionRepository definitionRepository) {
        this.definitionRepository = definitionRepository;
    }

    /**
     * Store a definition.
     */
    @PostMapping
    public ResponseEntity<WorkflowDefinition> saveDefinition(@RequestBody WorkflowDefinition definition) {
        if (definition.id() == null || definition.id().isBlank()) {
            throw new IllegalArgumentException("definition id is required");
        }
        definitionRepository.save(definition);
        log.info("Stored definition {} '{}' v{}", definition.id(), definition.name(), definition.version());
        return ResponseEntity.status(HttpStatus.CREATED).body(definition);
    }

    @GetMapping("/{definitionId}")
    public ResponseEntity<WorkflowDefinition> getDefinition(@PathVariable String definitionId) {
        return definitionRepository.findById(definitionId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new DefinitionNotFoundException(definitionId));
    }

    /**
     * List the definitions of a project, or every active definition.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowDefinition>> listDefinitions(
            @RequestParam(required = false) String projectId) {
        List<WorkflowDefinition> definitions = projectId != null
            ? definitionRepository.findByProject(projectId)
            : definitionRepository.findActive();
        return ResponseEntity.ok(definitions);
    }
}
