package org.pragmatica.online.grammar;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.online.error.GrammarError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered table of token kinds and their patterns. Lexing tries the kinds in insertion order.
 */
public final class LexRules {
    public static final String PUNCTUATION = "Punctuation";

    private final Map<String, Pattern> patterns;

    private LexRules(Map<String, Pattern> patterns) {
        this.patterns = Collections.unmodifiableMap(patterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Pattern> patterns() {
        return patterns;
    }

    public Option<Pattern> pattern(String kind) {
        return Option.of(patterns.get(kind));
    }

    public boolean hasPunctuation() {
        return patterns.containsKey(PUNCTUATION);
    }

    public static final class Builder {
        private final List<Source> sources = new ArrayList<>();

        private Builder() {}

        /**
         * Add a token kind matched by a regular expression.
         */
        public Builder rule(String kind, String regex) {
            sources.add(new Source(kind, regex, Option.none()));
            return this;
        }

        /**
         * Add a token kind matched by a precompiled pattern.
         */
        public Builder rule(String kind, Pattern pattern) {
            sources.add(new Source(kind, pattern.pattern(), Option.some(pattern)));
            return this;
        }

        /**
         * Add the punctuation kind.
         */
        public Builder punctuation(String regex) {
            return rule(PUNCTUATION, regex);
        }

        public Either<GrammarError, LexRules> build() {
            var result = new LinkedHashMap<String, Pattern>();
            for (var source : sources) {
                if (result.containsKey(source.kind())) {
                    return Either.left(new GrammarError.DuplicateDefinition(source.kind()));
                }
                if (source.compiled().isDefined()) {
                    result.put(source.kind(), source.compiled().get());
                    continue;
                }
                try {
                    result.put(source.kind(), Pattern.compile(source.regex()));
                } catch (PatternSyntaxException e) {
                    return Either.left(new GrammarError.InvalidPattern(source.kind(), source.regex(), e.getDescription()));
                }
            }
            return Either.right(new LexRules(result));
        }

        private record Source(String kind, String regex, Option<Pattern> compiled) {}
    }
}
