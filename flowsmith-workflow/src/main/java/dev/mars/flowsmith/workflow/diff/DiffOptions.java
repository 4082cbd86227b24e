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


package dev.mars.flowsmith.workflow.diff;

/**
 * Options for applying a diff batch. In validate-only mode every operation is checked
 * exactly as in a real run, but the caller's document is returned untouched.
 */
public final class DiffOptions {

    private static final DiffOptions DEFAULTS = new DiffOptions(false);
    private static final DiffOptions VALIDATE_ONLY = new DiffOptions(true);

    private final boolean validateOnly;

    private DiffOptions(boolean validateOnly) {
        this.validateOnly = validateOnly;
    }

    public static DiffOptions defaults() {
        return DEFAULTS;
    }

    public static DiffOptions validateOnly() {
        return VALIDATE_ONLY;
    }

    public static DiffOptions of(boolean validateOnly) {
        return validateOnly ? VALIDATE_ONLY : DEFAULTS;
    }

    public boolean isValidateOnly() {
        return validateOnly;
    }

    @Override
    public String toString() {
        return "DiffOptions{validateOnly=" + validateOnly + '}';
    }
}
