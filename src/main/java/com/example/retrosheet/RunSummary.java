package com.example.retrosheet;

import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Results of every entity of one run, in processing order.
 */
@Value
public class RunSummary {

    List<EntityResult> results;

    public RunSummary(List<EntityResult> results) {
        this.results = List.copyOf(results);
    }

    public List<EntityResult> succeeded() {
        return results.stream().filter(EntityResult::isSuccess).collect(Collectors.toList());
    }

    public List<EntityResult> failed() {
        return results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(EntityResult::isSuccess);
    }

    public Optional<EntityResult> result(String entity) {
        return results.stream().filter(r -> r.getEntity().equals(entity)).findFirst();
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(succeeded().size()).append(" of ").append(results.size()).append(" entities succeeded");
        for (EntityResult r : results) {
            sb.append(System.lineSeparator()).append("  ").append(r.getEntity()).append(": ");
            if (r.isSuccess()) {
                sb.append(r.getRows()).append(" rows -> ").append(r.getArtifact());
            } else {
                sb.append("FAILED (").append(r.getFailure()).append(") ").append(r.getMessage());
            }
        }
        return sb.toString();
    }
}
