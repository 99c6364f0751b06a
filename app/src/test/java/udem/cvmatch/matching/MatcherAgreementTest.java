package udem.cvmatch.matching;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class MatcherAgreementTest {

    static Stream<Arguments> cases() {
        return Stream.of(
                Arguments.of("python, sql and go", "sql", 1),
                Arguments.of("aaa aa aa", "aa", 2),
                Arguments.of("abababab abab", "abab", 1),
                Arguments.of("c++ and c# developer, c++", "c++", 2),
                Arguments.of("machine learning; machine-learning", "machine learning", 1),
                Arguments.of("docker", "docker", 1),
                Arguments.of("dockerfile kubernetes", "docker", 0),
                Arguments.of("go", "golang", 0),
                Arguments.of("r, r and rr", "r", 2)
        );
    }

    @ParameterizedTest
    @MethodSource("cases")
    void allAlgorithmsReportTheSameOccurrences(String text, String pattern, int expected) {
        for (var algorithm : Algorithm.values()) {
            assertThat(algorithm.search(text, pattern).occurrences())
                    .as(algorithm.displayName())
                    .isEqualTo(expected);
        }
    }

    @ParameterizedTest
    @MethodSource("cases")
    void comparisonsNeverDecreaseAsTheTextGrows(String text, String pattern, int ignored) {
        for (var algorithm : Algorithm.values()) {
            long previous = 0;
            for (int len = 0; len <= text.length(); len++) {
                long c = algorithm.search(text.substring(0, len), pattern).comparisons();
                assertThat(c).as(algorithm.displayName() + " at " + len).isGreaterThanOrEqualTo(previous);
                previous = c;
            }
        }
    }

    @ParameterizedTest
    @MethodSource("cases")
    void comparisonCountsAreReproducible(String text, String pattern, int ignored) {
        for (var algorithm : Algorithm.values()) {
            assertThat(algorithm.search(text, pattern)).isEqualTo(algorithm.search(text, pattern));
        }
    }
}
