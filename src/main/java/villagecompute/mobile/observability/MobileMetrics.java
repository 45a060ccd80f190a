package villagecompute.mobile.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custom counters for the mobile API, exported in Prometheus format at {@code /q/metrics}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li>{@code mobile_sdui_resolutions_total{result}} - Entrypoint resolutions by outcome (ok, invalid_key, decode,
 * storage)</li>
 * <li>{@code mobile_sdui_sections_served_total} - Sections returned to clients</li>
 * <li>{@code mobile_auth_attempts_total{result}} - Authorize calls by outcome (success, rejected)</li>
 * </ul>
 */
@ApplicationScoped
public class MobileMetrics {

    public static final String RESULT_OK = "ok";
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_REJECTED = "rejected";

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> resolutionCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> authCounters = new ConcurrentHashMap<>();

    /**
     * Records one entrypoint resolution.
     *
     * @param result
     *            "ok" or the lower-case failure reason
     * @param sectionCount
     *            sections returned (0 on failure)
     */
    public void recordResolution(String result, int sectionCount) {
        resolutionCounters.computeIfAbsent(result, k -> Counter.builder("mobile_sdui_resolutions_total")
                .description("Total entrypoint resolutions").tags(List.of(Tag.of("result", result))).register(registry))
                .increment();

        if (sectionCount > 0) {
            Counter.builder("mobile_sdui_sections_served_total").description("Total sections returned to clients")
                    .register(registry).increment(sectionCount);
        }
    }

    public void recordAuthAttempt(String result) {
        authCounters.computeIfAbsent(result, k -> Counter.builder("mobile_auth_attempts_total")
                .description("Total mobile authorize attempts").tags(List.of(Tag.of("result", result)))
                .register(registry)).increment();
    }
}
