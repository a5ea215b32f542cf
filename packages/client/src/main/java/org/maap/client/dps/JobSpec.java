package org.maap.client.dps;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work to run on DPS: which registered algorithm, which version, on which queue, with
 * which named inputs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSpec(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("algo_id") String algorithmId,
    @JsonProperty("version") String version,
    @JsonProperty("queue") String queue,
    @JsonProperty("username") String username,
    @JsonProperty("inputs") Map<String, String> inputs) {

  public JobSpec {
    Objects.requireNonNull(algorithmId, "algorithmId");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(queue, "queue");
    inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
  }

  public static Builder builder(String algorithmId, String version, String queue) {
    return new Builder(algorithmId, version, queue);
  }

  public static final class Builder {
    private final String algorithmId;
    private final String version;
    private final String queue;
    private String identifier;
    private String username;
    private final Map<String, String> inputs = new LinkedHashMap<>();

    private Builder(String algorithmId, String version, String queue) {
      this.algorithmId = algorithmId;
      this.version = version;
      this.queue = queue;
    }

    /** Free-form tag used to find the job later. */
    public Builder identifier(String identifier) {
      this.identifier = identifier;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder input(String name, String value) {
      inputs.put(name, value == null ? "" : value);
      return this;
    }

    public JobSpec build() {
      return new JobSpec(identifier, algorithmId, version, queue, username, inputs);
    }
  }
}
