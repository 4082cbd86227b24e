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

import dev.mars.flowsmith.nodetype.NodeTypeNames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds catalog type names close to an unknown one, for "did you mean" hints.
 */
final class NodeTypeSuggestions {

    private static final int MAX_SUGGESTIONS = 3;

    private NodeTypeSuggestions() {
    }

    /**
     * Returns up to three known types whose local name is close to the unknown type's,
     * best match first, in document (full) form.
     */
    static List<String> suggest(String unknownType, Collection<String> knownTypes) {
        String wanted = NodeTypeNames.localName(NodeTypeNames.normalize(unknownType)).toLowerCase(Locale.ROOT);
        int threshold = Math.max(2, wanted.length() / 3);

        List<Candidate> candidates = new ArrayList<>();
        for (String known : knownTypes) {
            String local = NodeTypeNames.localName(known).toLowerCase(Locale.ROOT);
            int distance = local.equals(wanted) ? 0 : levenshtein(local, wanted);
            if (distance <= threshold || local.contains(wanted) || wanted.contains(local)) {
                candidates.add(new Candidate(known, distance));
            }
        }
        candidates.sort(Comparator.comparingInt(Candidate::distance).thenComparing(Candidate::name));

        List<String> result = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (result.size() == MAX_SUGGESTIONS) {
                break;
            }
            result.add(NodeTypeNames.toDocumentForm(candidate.name()));
        }
        return result;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private record Candidate(String name, int distance) {
    }
}
