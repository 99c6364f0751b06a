package udem.cvmatch.scoring;

import udem.cvmatch.dto.JobDescriptionDto;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Disjoint keyword sets for one scoring pass. A keyword listed as both mandatory and
 * preferred is mandatory; {@code other} only keeps keywords that are in neither.
 */
public record KeywordClassification(
        Set<String> mandatory,
        Set<String> preferred,
        Set<String> other
) {
    public KeywordClassification {
        mandatory = clean(mandatory, Set.of());
        preferred = clean(preferred, mandatory);
        Set<String> taken = new HashSet<>(mandatory);
        taken.addAll(preferred);
        other = clean(other, taken);
    }

    public static KeywordClassification of(Collection<String> mandatory, Collection<String> preferred,
                                           Collection<String> other) {
        return new KeywordClassification(
                mandatory == null ? Set.of() : new LinkedHashSet<>(mandatory),
                preferred == null ? Set.of() : new LinkedHashSet<>(preferred),
                other == null ? Set.of() : new LinkedHashSet<>(other));
    }

    public static KeywordClassification from(JobDescriptionDto job) {
        return of(job.requiredSkills(), job.preferredSkills(), job.toolsAndFrameworks());
    }

    /**
     * Same classification over transformed keywords (e.g. case-folded), re-applying the
     * mandatory-first rule so keywords that collapse together keep the strongest category.
     */
    public KeywordClassification mapped(UnaryOperator<String> f) {
        return of(mandatory.stream().map(f).toList(),
                preferred.stream().map(f).toList(),
                other.stream().map(f).toList());
    }

    /**
     * Sorted union of all keywords, without duplicates.
     */
    public List<String> patterns() {
        TreeSet<String> all = new TreeSet<>(mandatory);
        all.addAll(preferred);
        all.addAll(other);
        return List.copyOf(all);
    }

    public boolean isEmpty() {
        return mandatory.isEmpty() && preferred.isEmpty() && other.isEmpty();
    }

    public Category categoryOf(String keyword) {
        if (mandatory.contains(keyword)) return Category.MANDATORY;
        if (preferred.contains(keyword)) return Category.PREFERRED;
        if (other.contains(keyword)) return Category.OTHER;
        return Category.UNKNOWN;
    }

    /**
     * Fails fast when there is nothing to match against.
     */
    public KeywordClassification requireKeywords() {
        if (isEmpty()) throw new NoKeywordsConfiguredException("No keywords configured for analysis");
        return this;
    }

    public enum Category {MANDATORY, PREFERRED, OTHER, UNKNOWN}

    private static Set<String> clean(Set<String> in, Set<String> exclude) {
        if (in == null) return Collections.emptySortedSet();
        return Collections.unmodifiableSortedSet(in.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(s -> !s.isEmpty() && !exclude.contains(s))
                .collect(Collectors.toCollection(TreeSet::new)));
    }
}
