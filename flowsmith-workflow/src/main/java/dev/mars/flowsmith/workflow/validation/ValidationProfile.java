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

import java.util.Locale;
import java.util.Optional;

/**
 * Named validation policies. A profile selects which rule categories run and adjusts
 * the severity of what they find.
 *
 * <table>
 *   <tr><th>Profile</th><th>Runs</th><th>Severity policy</th></tr>
 *   <tr><td>minimal</td><td>structure, connections, required fields</td><td>errors only</td></tr>
 *   <tr><td>runtime</td><td>everything except style rules</td><td>as reported</td></tr>
 *   <tr><td>ai-friendly</td><td>as runtime, plus examples and next steps</td><td>as reported</td></tr>
 *   <tr><td>strict</td><td>everything</td><td>style and topology warnings become errors</td></tr>
 * </table>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum ValidationProfile {
    MINIMAL("minimal"),
    RUNTIME("runtime"),
    AI_FRIENDLY("ai-friendly"),
    STRICT("strict");

    private final String profileName;

    ValidationProfile(String profileName) {
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }

    /**
     * Resolves a profile by its external name ({@code ai-friendly}) or enum name ({@code AI_FRIENDLY}).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ValidationProfile fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (ValidationProfile profile : values()) {
                if (profile.profileName.equals(normalized)) {
                    return profile;
                }
            }
        }
        throw new IllegalArgumentException("Unknown validation profile: " + name +
                ". Valid profiles: minimal, runtime, ai-friendly, strict");
    }

    public boolean runs(IssueCategory category) {
        switch (this) {
            case MINIMAL:
                return category == IssueCategory.STRUCTURE
                        || category == IssueCategory.CONNECTION
                        || category == IssueCategory.REQUIRED;
            case RUNTIME:
            case AI_FRIENDLY:
                return category != IssueCategory.STYLE;
            default:
                return true;
        }
    }

    /**
     * Whether node results include example configurations and next-step suggestions.
     */
    public boolean includesGuidance() {
        return this == AI_FRIENDLY;
    }

    /**
     * Applies this profile's policy to a raw finding. Applying a profile twice gives the
     * same result as applying it once.
     *
     * @return the issue as it should be reported, or empty if the profile drops it
     */
    public Optional<ValidationIssue> apply(ValidationIssue issue) {
        if (!runs(issue.getCategory())) {
            return Optional.empty();
        }
        if (this == MINIMAL && issue.getSeverity() != ValidationIssue.Severity.ERROR) {
            return Optional.empty();
        }
        if (this == STRICT && issue.getSeverity() == ValidationIssue.Severity.WARNING
                && (issue.getCategory() == IssueCategory.STYLE || issue.getCategory() == IssueCategory.TOPOLOGY)) {
            return Optional.of(issue.withSeverity(ValidationIssue.Severity.ERROR));
        }
        return Optional.of(issue);
    }

    @Override
    public String toString() {
        return profileName;
    }
}
