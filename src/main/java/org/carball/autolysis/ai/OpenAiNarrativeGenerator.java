package org.carball.autolysis.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.config.NarrativeConfig;
import org.carball.autolysis.model.analysis.ColumnProfile;
import org.carball.autolysis.model.analysis.CorrelationMatrix;
import org.carball.autolysis.model.analysis.ProfileWarning;
import org.carball.autolysis.model.cluster.ClusterAssignment;
import org.carball.autolysis.model.cluster.MergeTree;
import org.carball.autolysis.model.report.ProfileReport;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Narrative generator backed by an OpenAI-compatible chat completion endpoint.
 */
@Slf4j
public class OpenAiNarrativeGenerator implements NarrativeGenerator {

    private final NarrativeConfig config;
    private final NarrativePromptBuilder promptBuilder;
    private final OpenAIClient openAiClient;

    public OpenAiNarrativeGenerator(NarrativeConfig config) {
        this.config = config != null ? config : NarrativeConfig.disabled();
        this.promptBuilder = new NarrativePromptBuilder();

        if (this.config.isUsable()) {
            this.openAiClient = OpenAIOkHttpClient.builder()
                    .apiKey(this.config.getApiToken())
                    .baseUrl(this.config.getBaseUrl())
                    .timeout(this.config.getTimeout())
                    .maxRetries(this.config.getMaxRetries())
                    .build();
        } else {
            this.openAiClient = null;
        }
    }

    @Override
    public String generateNarrative(ProfileReport report, Map<String, Path> charts) {
        if (openAiClient == null) {
            log.info("Narrative service disabled, using fallback narrative");
            return fallbackNarrative(report);
        }

        log.info("Requesting narrative for {} from {}", report.tableName(), config.getModel());
        try {
            String prompt = promptBuilder.buildPrompt(report, charts);
            String narrative = callChatCompletion(prompt);
            if (narrative.isBlank()) {
                throw new IllegalStateException("Narrative service returned an empty response");
            }
            log.info("Received narrative of {} characters", narrative.length());
            return narrative;
        } catch (Exception e) {
            log.error("Error generating narrative: {}", e.getMessage(), e);
            return fallbackNarrative(report);
        }
    }

    private String callChatCompletion(String prompt) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(config.getModel())
                .addSystemMessage(NarrativePromptBuilder.SYSTEM_PROMPT)
                .addUserMessage(prompt)
                .temperature(config.getTemperature())
                .maxCompletionTokens(config.getMaxTokens())
                .build();

        log.debug("Request model: {}", config.getModel());
        log.debug("User prompt length: {} characters", prompt.length());
        log.trace("Full user prompt:\n{}", prompt);

        ChatCompletion completion = openAiClient.chat().completions().create(params);
        if (completion.choices().isEmpty()) {
            throw new IllegalStateException("Narrative service returned no choices");
        }
        String response = completion.choices().get(0).message().content().orElse("").trim();
        log.trace("Raw narrative response:\n{}", response);
        return response;
    }

    /**
     * Narrative assembled from the report alone, used when the service is disabled or fails.
     */
    public static String fallbackNarrative(ProfileReport report) {
        StringBuilder story = new StringBuilder();

        story.append("### The Data Received\n\n");
        story.append(String.format("The dataset **%s** holds %d rows across %d columns",
                report.tableName(), report.rowCount(), report.columnCount()));
        if (report.columnProfiles() != null) {
            long numeric = report.columnProfiles().values().stream().filter(ColumnProfile::isNumeric).count();
            story.append(String.format(" (%d numeric, %d categorical)", numeric,
                    report.columnProfiles().size() - numeric));
            int missing = report.missingValues().values().stream().mapToInt(Integer::intValue).sum();
            story.append(String.format(", with %d missing cells in total", missing));
        }
        story.append(".\n\n");

        story.append("### The Analysis Carried Out\n\n");
        story.append("Each column was summarized with descriptive statistics. Numeric columns were screened for ");
        story.append("outliers with the interquartile range rule, correlated pairwise, standardized and clustered ");
        story.append("with DBSCAN and with Ward hierarchical clustering.\n\n");

        story.append("### The Insights Discovered\n\n");
        appendInsights(story, report);

        story.append("### The Implications of Findings\n\n");
        if (report.outliers() != null && report.outliers().totalOutliers() > 0) {
            story.append("Outlying values deserve a closer look before the data feeds any model. ");
        }
        if (report.missingValues().values().stream().anyMatch(m -> m > 0)) {
            story.append("Missing values should be imputed or explained. ");
        }
        story.append("Cluster structure suggests segments worth analysing separately.\n");
        if (!report.warnings().isEmpty()) {
            story.append("\nSome results rest on little data: ");
            story.append(String.join("; ", report.warnings().stream().map(ProfileWarning::getDescription).toList()));
            story.append(".\n");
        }
        return story.toString();
    }

    private static void appendInsights(StringBuilder story, ProfileReport report) {
        boolean any = false;
        if (report.outliers() != null) {
            Optional<Map.Entry<String, Integer>> worst = report.outliers().counts().entrySet().stream()
                    .max(Map.Entry.comparingByValue());
            if (worst.isPresent() && worst.get().getValue() > 0) {
                story.append(String.format("- Column **%s** has the most outliers (%d).%n",
                        worst.get().getKey(), worst.get().getValue()));
                any = true;
            }
        }
        CorrelationMatrix correlation = report.correlation();
        if (correlation != null) {
            double best = 0.0;
            String pair = null;
            for (int i = 0; i < correlation.size(); i++) {
                for (int j = i + 1; j < correlation.size(); j++) {
                    double r = correlation.coefficient(i, j);
                    if (!Double.isNaN(r) && Math.abs(r) > Math.abs(best)) {
                        best = r;
                        pair = correlation.columnNames().get(i) + "** and **" + correlation.columnNames().get(j);
                    }
                }
            }
            if (pair != null) {
                story.append(String.format("- The strongest correlation is between **%s** (r = %.2f).%n", pair, best));
                any = true;
            }
        }
        ClusterAssignment clusters = report.clusters();
        if (clusters != null && !clusters.insufficientData()) {
            story.append(String.format("- DBSCAN found %d clusters and %d noise points among %d complete rows.%n",
                    clusters.clusterCount(), clusters.noiseCount(), clusters.size()));
            any = true;
        }
        MergeTree tree = report.mergeTree();
        if (tree != null && !tree.insufficientData()) {
            story.append(String.format("- The hierarchical tree joins %d rows, the final merge at distance %.2f.%n",
                    tree.leafCount(), tree.maxDistance()));
            any = true;
        }
        if (!any) {
            story.append("- No notable patterns could be established.\n");
        }
        story.append("\n");
    }
}
