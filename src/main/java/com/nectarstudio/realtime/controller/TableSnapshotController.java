package com.nectarstudio.realtime.controller;

import com.nectarstudio.realtime.exception.SubscriptionConfigurationException;
import com.nectarstudio.realtime.exception.TransientSourceException;
import com.nectarstudio.realtime.model.dto.SnapshotResponse;
import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.service.TableSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Initial list fetch. With {@code realtime=true} the response also tells the client where
 * to subscribe for live updates.
 */
@Slf4j
@RestController
@RequestMapping("/api/v2")
@RequiredArgsConstructor
public class TableSnapshotController {

    private final TableSnapshotService tableSnapshotService;

    @GetMapping("/{serviceName}/_table/{entityName}")
    public ResponseEntity<SnapshotResponse> getTable(@PathVariable String serviceName,
                                                     @PathVariable String entityName,
                                                     @RequestParam(required = false) Integer page,
                                                     @RequestParam(required = false) String fields,
                                                     @RequestParam(required = false) String sort,
                                                     @RequestParam(required = false) String filter,
                                                     @RequestParam(defaultValue = "false") boolean realtime) {
        log.debug("📄 Snapshot requested for {}/{} (realtime={})", serviceName, entityName, realtime);
        TableFilters filters = new TableFilters(page, fields, sort, filter);
        return ResponseEntity.ok(tableSnapshotService.fetch(serviceName, entityName, filters, realtime));
    }

    @ExceptionHandler(SubscriptionConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfigurationError(SubscriptionConfigurationException e) {
        log.warn("❌ Snapshot request rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(TransientSourceException.class)
    public ResponseEntity<Map<String, String>> handleSourceError(TransientSourceException e) {
        log.error("❌ Snapshot read failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }
}
