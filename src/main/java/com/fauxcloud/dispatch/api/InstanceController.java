package com.fauxcloud.dispatch.api;

import com.fauxcloud.core.error.ValidationException;
import com.fauxcloud.core.lifecycle.InstanceManager;
import com.fauxcloud.core.lifecycle.LifecycleProperties;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceCreateRequest;
import com.fauxcloud.core.model.InstanceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for instance lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/instances")
public class InstanceController {

    private static final Logger log = LoggerFactory.getLogger(InstanceController.class);

    private final InstanceManager instanceManager;
    private final LifecycleProperties lifecycleProperties;
    private final InstanceEventStream eventStream;

    public InstanceController(InstanceManager instanceManager, LifecycleProperties lifecycleProperties,
                              InstanceEventStream eventStream) {
        this.instanceManager = instanceManager;
        this.lifecycleProperties = lifecycleProperties;
        this.eventStream = eventStream;
    }

    /**
     * POST /api/v1/instances: Create and provision an instance. Optionally starts it.
     */
    @PostMapping
    public ResponseEntity<Instance> create(@RequestBody InstanceCreateRequest request,
                                           @RequestParam(name = "start", defaultValue = "false") boolean start) {
        Instance instance = instanceManager.create(request);
        log.info("Accepted instance {} ({})", instance.getId(), instance.getName());
        if (start) {
            instance = instanceManager.start(instance.getId());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(instance);
    }

    /**
     * GET /api/v1/instances: List instances, filtered by {@code status} and repeated {@code label=key=value}.
     */
    @GetMapping
    public List<Instance> list(@RequestParam(name = "status", required = false) InstanceStatus status,
                               @RequestParam(name = "label", required = false) List<String> labels) {
        return instanceManager.list(status, parseLabels(labels));
    }

    @GetMapping("/{id}")
    public Instance get(@PathVariable("id") String id) {
        return instanceManager.get(id);
    }

    @PostMapping("/{id}/start")
    public Instance start(@PathVariable("id") String id) {
        return instanceManager.start(id);
    }

    @PostMapping("/{id}/stop")
    public Instance stop(@PathVariable("id") String id) {
        return instanceManager.stop(id);
    }

    @PostMapping("/{id}/extend")
    public Instance extend(@PathVariable("id") String id, @RequestBody ExtendTtlRequest request) {
        return instanceManager.extendTtl(id, request.hours());
    }

    /**
     * POST /api/v1/instances/{id}/wait: Block until the instance is RUNNING or the timeout elapses.
     */
    @PostMapping("/{id}/wait")
    public Instance waitForReady(@PathVariable("id") String id,
                                 @RequestParam(name = "timeout_seconds", required = false) Long timeoutSeconds)
            throws InterruptedException {
        Duration timeout = timeoutSeconds != null
                ? Duration.ofSeconds(timeoutSeconds)
                : lifecycleProperties.getReadyTimeout();
        return instanceManager.waitForReady(id, timeout);
    }

    @DeleteMapping("/{id}")
    public Instance destroy(@PathVariable("id") String id) {
        return instanceManager.destroy(id);
    }

    @GetMapping("/{id}/health")
    public Map<String, Object> health(@PathVariable("id") String id) {
        InstanceStatus status = instanceManager.getHealth(id);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", id);
        result.put("status", status.name());
        return result;
    }

    @GetMapping(value = "/{id}/logs", produces = MediaType.TEXT_PLAIN_VALUE)
    public String logs(@PathVariable("id") String id,
                       @RequestParam(name = "component", required = false) String component,
                       @RequestParam(name = "tail", defaultValue = "100") int tail) {
        return instanceManager.getLogs(id, component, tail);
    }

    /**
     * GET /api/v1/instances/{id}/events: Server-sent stream of the instance's lifecycle events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable("id") String id) {
        return eventStream.open(instanceManager.get(id));
    }

    static Map<String, String> parseLabels(List<String> labels) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (labels == null) {
            return parsed;
        }
        for (String label : labels) {
            int eq = label.indexOf('=');
            if (eq <= 0) {
                throw new ValidationException(List.of("label filter must be key=value, got " + label));
            }
            parsed.put(label.substring(0, eq), label.substring(eq + 1));
        }
        return parsed;
    }
}
