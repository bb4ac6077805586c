package secretscanapp;

import com.google.gson.ExclusionStrategy;
import com.google.gson.FieldAttributes;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * Renders scan job status as JSON with snake_case field names.
 *
 * Running jobs: {@code {job_id, status, progress, message}}. Completed jobs add
 * {@code results: {summary, findings, repo_url}}. Raw secret values are left out unless
 * explicitly requested.
 */
public class ScanJsonMapper {
    private final Gson gson;

    public ScanJsonMapper() {
        this(false);
    }

    public ScanJsonMapper(boolean includeRawValues) {
        GsonBuilder builder = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping();
        if (!includeRawValues) {
            builder.setExclusionStrategies(new RawValueExclusion());
        }
        this.gson = builder.create();
    }

    public JsonObject toStatusTree(ScanJob job) {
        JsonObject json = new JsonObject();
        json.addProperty("job_id", job.getId());
        json.addProperty("status", job.getStatus().getId());
        json.addProperty("progress", job.getProgress());
        json.addProperty("message", job.getMessage());
        if (job.getMode() != null) {
            json.addProperty("mode", job.getMode().getId());
        }
        if (job.getStatus() == ScanStatus.COMPLETED && job.getResult() != null) {
            json.add("results", gson.toJsonTree(job.getResult()));
        }
        return json;
    }

    public String toStatusJson(ScanJob job) {
        return gson.toJson(toStatusTree(job));
    }

    public String toJson(ScanResult result) {
        return gson.toJson(result);
    }

    private static final class RawValueExclusion implements ExclusionStrategy {
        @Override
        public boolean shouldSkipField(FieldAttributes field) {
            return field.getDeclaringClass() == Finding.class && "rawValue".equals(field.getName());
        }

        @Override
        public boolean shouldSkipClass(Class<?> clazz) {
            return false;
        }
    }
}
