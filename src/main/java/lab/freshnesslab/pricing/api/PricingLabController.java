package lab.freshnesslab.pricing.api;

import java.time.Duration;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.MetricsSnapshot;
import lab.freshnesslab.pricing.dto.DatabaseSizeResponse;
import lab.freshnesslab.pricing.dto.IndexStatusResponse;
import lab.freshnesslab.pricing.dto.IsolationResponse;
import lab.freshnesslab.pricing.dto.ProbeResponse;
import lab.freshnesslab.pricing.dto.RefreshIntervalResponse;
import lab.freshnesslab.pricing.dto.RefreshResponse;
import lab.freshnesslab.pricing.dto.TrafficResponse;
import lab.freshnesslab.pricing.lab.ProbeMetricsSnapshot;
import lab.freshnesslab.pricing.service.LoadGenerator;
import lab.freshnesslab.pricing.service.MaterializedViewRefresher;
import lab.freshnesslab.pricing.service.MetricsReportService;
import lab.freshnesslab.pricing.service.ProbeExecutor;
import lab.freshnesslab.pricing.service.StreamingAdminService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/lab")
public class PricingLabController {

    private static final Logger log = LoggerFactory.getLogger(PricingLabController.class);
    private final MetricsReportService reportService;
    private final MaterializedViewRefresher refresher;
    private final LoadGenerator loadGenerator;
    private final ProbeExecutor probeExecutor;
    private final StreamingAdminService streamingAdmin;

    public PricingLabController(MetricsReportService reportService,
                                MaterializedViewRefresher refresher,
                                LoadGenerator loadGenerator,
                                ProbeExecutor probeExecutor,
                                StreamingAdminService streamingAdmin) {
        this.reportService = reportService;
        this.refresher = refresher;
        this.loadGenerator = loadGenerator;
        this.probeExecutor = probeExecutor;
        this.streamingAdmin = streamingAdmin;
    }

    @GetMapping("/metrics/{productId}")
    public ResponseEntity<MetricsSnapshot> metrics(@PathVariable long productId) {
        return ResponseEntity.ok(reportService.getSnapshot(productId));
    }

    @PostMapping("/refresh")
    public ResponseEntity<RefreshResponse> refresh() {
        log.info("Forcing materialized view refresh");
        Duration duration = refresher.refreshOnce();
        return ResponseEntity.ok(new RefreshResponse("success", duration.toNanos() / 1_000_000_000.0));
    }

    @PostMapping("/configure-refresh-interval/{interval}")
    public ResponseEntity<RefreshIntervalResponse> configureRefreshInterval(@PathVariable int interval) {
        log.info("Configuring refresh interval intervalSeconds={}", interval);
        refresher.setRefreshInterval(interval);
        return ResponseEntity.ok(new RefreshIntervalResponse("success", refresher.getRefreshInterval()));
    }

    @GetMapping("/current-refresh-interval")
    public ResponseEntity<RefreshIntervalResponse> currentRefreshInterval() {
        return ResponseEntity.ok(new RefreshIntervalResponse("success", refresher.getRefreshInterval()));
    }

    @PostMapping("/traffic/{backend}")
    public ResponseEntity<TrafficResponse> traffic(@PathVariable String backend,
                                                   @RequestParam boolean enabled) {
        Backend target = Backend.from(backend);
        loadGenerator.setTrafficEnabled(target, enabled);
        return ResponseEntity.ok(new TrafficResponse(target.statsKey(),
                loadGenerator.isTrafficEnabled(target),
                loadGenerator.activeWorkers(target),
                loadGenerator.currentLimits().get(target)));
    }

    @PostMapping("/probe/{backend}")
    public ResponseEntity<ProbeResponse> probe(@PathVariable String backend) {
        Backend target = Backend.from(backend);
        return ResponseEntity.ok(ProbeResponse.from(probeExecutor.probe(target)));
    }

    @PostMapping("/toggle-view-index")
    public ResponseEntity<IndexStatusResponse> toggleViewIndex() {
        boolean exists = streamingAdmin.toggleReadinessIndex();
        String message = exists ? "Index created successfully" : "Index dropped successfully";
        return ResponseEntity.ok(new IndexStatusResponse(message, exists));
    }

    @GetMapping("/view-index-status")
    public ResponseEntity<IndexStatusResponse> viewIndexStatus() {
        boolean exists = streamingAdmin.readinessIndexStatus();
        return ResponseEntity.ok(new IndexStatusResponse(exists ? "Index present" : "Index absent", exists));
    }

    @PostMapping("/toggle-isolation")
    public ResponseEntity<IsolationResponse> toggleIsolation() {
        return ResponseEntity.ok(new IsolationResponse("success", streamingAdmin.toggleIsolationLevel()));
    }

    @GetMapping("/database-size")
    public ResponseEntity<DatabaseSizeResponse> databaseSize() {
        return ResponseEntity.ok(new DatabaseSizeResponse(reportService.databaseSizeGb()));
    }

    @GetMapping("/probes/summary")
    public ResponseEntity<ProbeMetricsSnapshot> probeSummary() {
        return ResponseEntity.ok(reportService.probeSummary());
    }

    @PostMapping("/probes/reset")
    public ResponseEntity<Void> resetProbes() {
        log.info("Resetting probe summary");
        reportService.resetProbeSummary();
        return ResponseEntity.noContent().build();
    }
}
