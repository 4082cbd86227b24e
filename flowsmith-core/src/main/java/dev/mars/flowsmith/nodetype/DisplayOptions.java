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


package dev.mars.flowsmith.nodetype;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Visibility condition of a property. Every entry under {@code show} must match for the
 * property to be shown; any matching entry under {@code hide} hides it. Each entry maps
 * a sibling field name (or {@code @version}) to the list of values it is compared with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class DisplayOptions {

    public static final String VERSION_FIELD = "@version";

    private final Map<String, List<Object>> show;
    private final Map<String, List<Object>> hide;

    public DisplayOptions(Map<String, List<Object>> show, Map<String, List<Object>> hide) {
        this.show = copy(show);
        this.hide = copy(hide);
    }

    public static DisplayOptions show(Map<String, List<Object>> show) {
        return new DisplayOptions(show, null);
    }

    public static DisplayOptions hide(Map<String, List<Object>> hide) {
        return new DisplayOptions(null, hide);
    }

    private static Map<String, List<Object>> copy(Map<String, List<Object>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, values != null
                ? Collections.unmodifiableList(new ArrayList<>(values))
                : List.of()));
        return Collections.unmodifiableMap(copy);
    }

    public Map<String, List<Object>> getShow() {
        return show;
    }

    public Map<String, List<Object>> getHide() {
        return hide;
    }

    public boolean isEmpty() {
        return show.isEmpty() && hide.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DisplayOptions that = (DisplayOptions) o;
        return Objects.equals(show, that.show) && Objects.equals(hide, that.hide);
    }

    @Override
    public int hashCode() {
        return Objects.hash(show, hide);
    }

    @Override
    public String toString() {
        return "DisplayOptions{show=" + show + ", hide=" + hide + '}';
    }
}
