/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.flowsmith.workflow.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a workflow document. Semantic findings are accumulated here
 * rather than thrown, so one pass surfaces every issue found.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ValidationReport {

    private final ValidationProfile profile;
    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;
    private final List<ValidationIssue> infos;
    private final List<String> suggestions;
    private final ValidationStatistics statistics;

    private ValidationReport(Builder builder) {
        this.profile = builder.profile;
        this.errors = List.copyOf(builder.errors);
        this.warnings = List.copyOf(builder.warnings);
        this.infos = List.copyOf(builder.infos);
        this.suggestions = List.copyOf(builder.suggestions);
        this.statistics = builder.statistics.copy();
    }

    public static Builder builder(ValidationProfile profile) {
        return new Builder(profile);
    }

    public ValidationProfile getProfile() {
        return profile;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationIssue> getErrors() {
        return errors;
    }

    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    /**
     * Informational notes that never affect validity.
     */
    public List<ValidationIssue> getInfos() {
        return infos;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public ValidationStatistics getStatistics() {
        return statistics;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    public List<ValidationIssue> getAllIssues() {
        List<ValidationIssue> all = new ArrayList<>(errors.size() + warnings.size() + infos.size());
        all.addAll(errors);
        all.addAll(warnings);
        all.addAll(infos);
        return all;
    }

    public List<ValidationIssue> getIssuesForNode(String nodeName) {
        List<ValidationIssue> result = new ArrayList<>();
        for (ValidationIssue issue : getAllIssues()) {
            if (Objects.equals(nodeName, issue.getNodeName())) {
                result.add(issue);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationReport that = (ValidationReport) o;
        return profile == that.profile &&
               Objects.equals(errors, that.errors) &&
               Objects.equals(warnings, that.warnings) &&
               Objects.equals(infos, that.infos) &&
               Objects.equals(suggestions, that.suggestions) &&
               Objects.equals(statistics, that.statistics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(profile, errors, warnings, infos, suggestions, statistics);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationReport{");
        sb.append("profile=").append(profile);
        sb.append(", valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append(", infos=").append(infos.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * Accumulates findings, routing each through the profile before it is recorded.
     */
    public static class Builder {
        private final ValidationProfile profile;
        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<ValidationIssue> warnings = new ArrayList<>();
        private final List<ValidationIssue> infos = new ArrayList<>();
        private final List<String> suggestions = new ArrayList<>();
        private final ValidationStatistics statistics = new ValidationStatistics();

        private Builder(ValidationProfile profile) {
            this.profile = Objects.requireNonNull(profile, "Profile cannot be null");
        }

        public ValidationProfile getProfile() {
            return profile;
        }

        public Builder add(ValidationIssue issue) {
            profile.apply(issue).ifPresent(accepted -> {
                switch (accepted.getSeverity()) {
                    case ERROR:
                        errors.add(accepted);
                        break;
                    case WARNING:
                        warnings.add(accepted);
                        break;
                    default:
                        infos.add(accepted);
                        break;
                }
            });
            return this;
        }

        public Builder addAll(List<ValidationIssue> issues) {
            for (ValidationIssue issue : issues) {
                add(issue);
            }
            return this;
        }

        public Builder addSuggestion(String suggestion) {
            if (!suggestions.contains(suggestion)) {
                suggestions.add(suggestion);
            }
            return this;
        }

        public ValidationStatistics statistics() {
            return statistics;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationReport build() {
            return new ValidationReport(this);
        }
    }
}
