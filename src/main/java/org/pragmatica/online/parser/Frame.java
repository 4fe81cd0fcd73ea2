package org.pragmatica.online.parser;

import io.vavr.control.Option;
import org.pragmatica.online.grammar.Captures;
import org.pragmatica.online.grammar.RuleDefinition;
import org.pragmatica.online.grammar.RuleItem;

import java.util.Objects;

/**
 * One activation of a rule on the parser stack: step cursor plus scratch fields.
 */
public final class Frame {
    private final String kind;
    private final RuleDefinition rule;
    private int step;
    private String name;
    private String type;
    private boolean needsSeparator;

    private Frame(String kind, RuleDefinition rule, int step, String name, String type, boolean needsSeparator) {
        this.kind = kind;
        this.rule = rule;
        this.step = step;
        this.name = name;
        this.type = type;
        this.needsSeparator = needsSeparator;
    }

    static Frame enter(String kind, RuleDefinition rule) {
        return new Frame(kind, rule, 0, null, null, false);
    }

    Frame copy() {
        return new Frame(kind, rule, step, name, type, needsSeparator);
    }

    public String kind() {
        return kind;
    }

    public RuleDefinition rule() {
        return rule;
    }

    public int step() {
        return step;
    }

    /**
     * Name captured by a terminal update, if any.
     */
    public Option<String> name() {
        return Option.of(name);
    }

    void setName(String name) {
        this.name = name;
    }

    /**
     * Type captured by a terminal update, if any.
     */
    public Option<String> type() {
        return Option.of(type);
    }

    void setType(String type) {
        this.type = type;
    }

    /**
     * Write access to the scratch fields for terminal updates. Hosts inspecting a state only read.
     */
    Captures captures() {
        return new Captures() {
            @Override
            public void setName(String name) {
                Frame.this.setName(name);
            }

            @Override
            public void setType(String type) {
                Frame.this.setType(type);
            }
        };
    }

    public boolean needsSeparator() {
        return needsSeparator;
    }

    void setNeedsSeparator(boolean needsSeparator) {
        this.needsSeparator = needsSeparator;
    }

    void toggleSeparator() {
        needsSeparator = !needsSeparator;
    }

    void advance() {
        step++;
    }

    boolean isExhausted() {
        return rule.isExhausted(step);
    }

    /**
     * Item at the current step, none for forks and exhausted sequences.
     */
    Option<RuleItem> currentItem() {
        if (rule instanceof RuleDefinition.Sequence sequence && !sequence.isExhausted(step)) {
            return Option.some(sequence.item(step));
        }
        return Option.none();
    }

    Option<RuleItem.ListOf> currentList() {
        return currentItem().filter(RuleItem.ListOf.class::isInstance)
                            .map(RuleItem.ListOf.class::cast);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame other)) {
            return false;
        }
        return step == other.step
               && needsSeparator == other.needsSeparator
               && kind.equals(other.kind)
               && rule == other.rule
               && Objects.equals(name, other.name)
               && Objects.equals(type, other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, step, name, type, needsSeparator);
    }

    @Override
    public String toString() {
        return kind + "@" + step + (needsSeparator ? "," : "");
    }
}
