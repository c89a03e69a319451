package org.carball.autolysis.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusteringSettings {

    // DBSCAN neighbourhood radius, in standardized units
    @JsonProperty("eps")
    private double eps = 0.5;

    // Points (self included) needed inside eps for a core point
    @JsonProperty("min_samples")
    private int minSamples = 5;

    @JsonProperty("iqr_multiplier")
    private double iqrMultiplier = 1.5;

    // 0 means one worker per available processor
    @JsonProperty("threads")
    private int threads = 0;

    public static ClusteringSettings defaults() {
        return new ClusteringSettings();
    }

    public static ClusteringSettings of(double eps, int minSamples) {
        ClusteringSettings settings = new ClusteringSettings();
        settings.setEps(eps);
        settings.setMinSamples(minSamples);
        return settings;
    }

    public ClusteringSettings copy() {
        ClusteringSettings copy = new ClusteringSettings();
        copy.setEps(eps);
        copy.setMinSamples(minSamples);
        copy.setIqrMultiplier(iqrMultiplier);
        copy.setThreads(threads);
        return copy;
    }

    /**
     * Rejects parameters no component can run with and logs warnings for values that are
     * legal but unlikely to be intended.
     *
     * @throws ConfigurationException if eps is not a positive finite number, minSamples is
     *                                below 1, the IQR multiplier is not positive or threads is negative
     */
    public void validate() {
        if (!(eps > 0) || Double.isInfinite(eps)) {
            throw new ConfigurationException("DBSCAN eps must be a positive finite number, got " + eps);
        }
        if (minSamples < 1) {
            throw new ConfigurationException("DBSCAN min_samples must be at least 1, got " + minSamples);
        }
        if (!(iqrMultiplier > 0) || Double.isInfinite(iqrMultiplier)) {
            throw new ConfigurationException("IQR multiplier must be a positive finite number, got " + iqrMultiplier);
        }
        if (threads < 0) {
            throw new ConfigurationException("Thread count must not be negative, got " + threads);
        }

        if (eps > 10.0) {
            log.warn("DBSCAN eps ({}) is large for standardized data; most rows will share one cluster", eps);
        }
        if (minSamples == 1) {
            log.warn("DBSCAN min_samples of 1 makes every row a core point; no row will be noise");
        }

        log.debug("Using clustering settings - eps: {}, minSamples: {}, iqrMultiplier: {}, threads: {}",
                eps, minSamples, iqrMultiplier, threads);
    }

    public int effectiveThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    public String getDescription() {
        return String.format("eps=%.3f, min_samples=%d, iqr_multiplier=%.2f, threads=%s",
                eps, minSamples, iqrMultiplier, threads > 0 ? String.valueOf(threads) : "auto");
    }
}
