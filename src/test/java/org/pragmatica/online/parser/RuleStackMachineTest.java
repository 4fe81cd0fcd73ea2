package org.pragmatica.online.parser;

import io.vavr.control.Option;
import org.junit.jupiter.api.Test;
import org.pragmatica.online.OnlineParser;
import org.pragmatica.online.TestGrammars;
import org.pragmatica.online.grammar.Grammar;
import org.pragmatica.online.grammar.RuleItem;
import org.pragmatica.online.lexer.LineStream;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.online.TestGrammars.styles;
import static org.pragmatica.online.grammar.Rules.*;

class RuleStackMachineTest {

    // === List Scenarios ===

    @Test
    void numberList_stylesEveryToken() {
        var machine = TestGrammars.machine(TestGrammars.numberList());
        var state = machine.startState();

        var styles = styles(machine, state, "[1,2,3]");

        assertEquals(List.of("punctuation", "number", "punctuation", "number", "punctuation", "number", "punctuation"),
                     styles);
        assertEquals(1, state.depth());
        assertEquals("Document", state.kind());
    }

    @Test
    void numberList_emptyListSkipsToClosingBracket() {
        var machine = TestGrammars.machine(TestGrammars.numberList());
        var state = machine.startState();

        assertEquals(List.of("punctuation", "punctuation"), styles(machine, state, "[]"));
        assertEquals(3, state.step());
    }

    @Test
    void numberList_trailingSeparatorIsAccepted() {
        var machine = TestGrammars.machine(TestGrammars.numberList());
        var state = machine.startState();

        assertEquals(List.of("punctuation", "number", "punctuation", "punctuation"), styles(machine, state, "[1,]"));
    }

    @Test
    void unrecognizedToken_rollsBackAndResynchronizes() {
        var machine = TestGrammars.machine(TestGrammars.numberList());
        var state = machine.startState();

        var styles = styles(machine, state, "[ 1 @ 2 ]");

        assertEquals(List.of("punctuation", "number", "invalidchar", "invalidchar", "punctuation"), styles);
        assertEquals(1, state.depth());
        assertEquals(3, state.step());
    }

    @Test
    void unrecognizedToken_leavesStateUntouched() {
        var machine = TestGrammars.machine(TestGrammars.numberList());
        var state = machine.startState();
        var stream = LineStream.of("[ 1 2", 2);

        machine.token(stream, state);
        machine.token(stream, state);
        machine.token(stream, state);
        // Whitespace commits the pending advance of '1'
        assertEquals("ws", machine.token(stream, state));
        var before = state.copy();

        assertEquals("invalidchar", machine.token(stream, state));
        assertEquals(before, state);
        assertTrue(state.frame().needsSeparator());
    }

    @Test
    void unlexableCharacters_areSkippedAsOneRun() {
        var machine = TestGrammars.machine(TestGrammars.numberList());
        var state = machine.startState();
        var stream = LineStream.of("@#$ [", 2);

        assertEquals("invalidchar", machine.token(stream, state));
        assertEquals("@#$", stream.current());
        assertEquals(machine.startState(), state);
    }

    @Test
    void listOfEmptyMatchingElements_endsInsteadOfRepeating() {
        var grammar = Grammar.builder(TestGrammars.lexRules())
                             .rule("Document", list("Bang"))
                             .rule("Bang", opt(p("!")))
                             .build()
                             .get();
        var machine = TestGrammars.machine(grammar);
        var state = machine.startState();

        var style = assertTimeoutPreemptively(Duration.ofSeconds(3),
                                              () -> machine.token(LineStream.of("x", 2), state));

        assertEquals("invalidchar", style);
        assertEquals(machine.startState(), state);
    }

    @Test
    void emptyListOfOptionalElements_skipsToClosingBracket() {
        var grammar = Grammar.builder(TestGrammars.lexRules())
                             .rule("Document", p("["), list("Item"), p("]"))
                             .rule("Item", opt(t("Number", "number")))
                             .build()
                             .get();
        var machine = TestGrammars.machine(grammar);
        var state = machine.startState();

        var styles = assertTimeoutPreemptively(Duration.ofSeconds(3), () -> styles(machine, state, "[ ]"));

        assertEquals(List.of("punctuation", "punctuation"), styles);
        assertEquals(3, state.step());
    }

    @Test
    void listOfOptionalElements_stillRepeatsMatchedElements() {
        var grammar = Grammar.builder(TestGrammars.lexRules())
                             .rule("Document", p("["), list("Item"), p("]"))
                             .rule("Item", opt(t("Number", "number")))
                             .build()
                             .get();
        var machine = TestGrammars.machine(grammar);
        var state = machine.startState();

        var styles = assertTimeoutPreemptively(Duration.ofSeconds(3), () -> styles(machine, state, "[1 2 3]"));

        assertEquals(List.of("punctuation", "number", "number", "number", "punctuation"), styles);
        assertEquals(3, state.step());
    }

    // === Optional ===

    @Test
    void optionalItem_isSkippedWhenAbsent() {
        var machine = TestGrammars.machine(TestGrammars.optionalBang());
        var state = machine.startState();

        assertEquals(List.of("name"), styles(machine, state, "foo "));
        assertEquals(2, state.step());
        assertEquals(1, state.depth());
    }

    @Test
    void optionalItem_matchesWhenPresent() {
        var machine = TestGrammars.machine(TestGrammars.optionalBang());
        var state = machine.startState();

        assertEquals(List.of("punctuation", "name"), styles(machine, state, "!foo"));
    }

    @Test
    void completedRoot_rejectsFurtherTokens() {
        var machine = TestGrammars.machine(TestGrammars.optionalBang());
        var state = machine.startState();

        assertEquals(List.of("name", "invalidchar"), styles(machine, state, "foo bar"));
        assertEquals(1, state.depth());
    }

    // === Deferred Advance ===

    @Test
    void nonPunctuationMatch_isCommittedOnNextToken() {
        var machine = TestGrammars.machine(TestGrammars.optionalBang());
        var state = machine.startState();
        var stream = LineStream.of("foo ", 2);

        assertEquals("name", machine.token(stream, state));
        assertTrue(state.needsAdvance());
        assertEquals(1, state.step());

        assertEquals("ws", machine.token(stream, state));
        assertFalse(state.needsAdvance());
        assertEquals(2, state.step());
    }

    @Test
    void punctuationMatch_isCommittedImmediately() {
        var machine = TestGrammars.machine(TestGrammars.numberList());
        var state = machine.startState();

        machine.token(LineStream.of("[", 2), state);

        assertFalse(state.needsAdvance());
        assertEquals(1, state.step());
    }

    // === Rule Push and Fork ===

    @Test
    void nonTerminal_pushesFrameAndPopsOnCompletion() {
        var machine = TestGrammars.machine(TestGrammars.nestedValues());
        var state = machine.startState();
        var stream = LineStream.of("[[1]]", 2);

        machine.token(stream, state);
        assertEquals("Array", state.kind());
        assertEquals(3, state.depth());
        var kinds = new ArrayList<String>();
        state.forEachState(frame -> kinds.add(frame.kind()));
        assertEquals(List.of("Document", "Value", "Array"), kinds);

        while (!stream.eol()) {
            machine.token(stream, state);
        }
        assertEquals(1, state.depth());
        assertEquals("Document", state.kind());
        assertEquals(0, state.step());
    }

    @Test
    void fork_dispatchesOnFirstToken() {
        var machine = TestGrammars.machine(TestGrammars.nestedValues());
        var state = machine.startState();

        var styles = styles(machine, state, "1 [2, [3]] 4");

        assertEquals(List.of("number", "punctuation", "number", "punctuation", "punctuation", "number",
                             "punctuation", "punctuation", "number"),
                     styles);
    }

    @Test
    void fork_withoutChoice_unwindsToEnclosingList() {
        var machine = TestGrammars.machine(TestGrammars.nestedValues());
        var state = machine.startState();

        assertEquals(List.of("number", "invalidchar", "number"), styles(machine, state, "1 foo 2"));
    }

    @Test
    void fork_choosingUndefinedRule_isTreatedAsMismatch() {
        var grammar = Grammar.builder(TestGrammars.lexRules())
                             .rule("Document", opt(ref("Pick")), t("Name", "name"))
                             .rule("Pick", fork(token -> Option.<RuleItem>some(ref("Missing"))))
                             .build()
                             .get();
        var machine = TestGrammars.machine(grammar);

        assertEquals(List.of("name"), styles(machine, machine.startState(), "foo"));
    }

    @Test
    void terminalUpdate_capturesNameIntoFrame() {
        var grammar = Grammar.builder(TestGrammars.lexRules())
                             .rule("Document", list("Definition"))
                             .rule("Definition",
                                   p("("),
                                   t("Name", "def").withUpdate((frame, token) -> frame.setName(token.value())),
                                   opt(t("Name", "type").withUpdate((frame, token) -> frame.setType(token.value()))),
                                   p(")"))
                             .build()
                             .get();
        var machine = TestGrammars.machine(grammar);
        var state = machine.startState();

        styles(machine, state, "(hero Person");

        assertEquals("Definition", state.kind());
        assertEquals(Option.some("hero"), state.name());
        assertEquals(Option.some("Person"), state.type());
        assertEquals(Option.none(), state.prevState().flatMap(Frame::name));
    }

    // === Recursion Guard ===

    @Test
    void cyclicGrammar_hitsDepthLimitAndRollsBack() {
        var grammar = Grammar.builder(TestGrammars.lexRules())
                             .rule("Document", ref("A"))
                             .rule("A", ref("B"))
                             .rule("B", ref("A"))
                             .build()
                             .get();
        var machine = OnlineParser.builder(grammar)
                                  .maxStackDepth(16)
                                  .build()
                                  .get();
        var state = machine.startState();

        assertEquals(List.of("invalidchar"), styles(machine, state, "x"));
        assertEquals(machine.startState(), state);
    }

    @Test
    void cyclicOptionalRule_fallsThroughToNextItem() {
        var grammar = Grammar.builder(TestGrammars.lexRules())
                             .rule("Document", opt(ref("Loop")), t("Name", "name"))
                             .rule("Loop", ref("Loop"))
                             .build()
                             .get();
        var machine = OnlineParser.builder(grammar)
                                  .maxStackDepth(8)
                                  .build()
                                  .get();
        var state = machine.startState();

        assertEquals(List.of("name"), styles(machine, state, "x"));
        assertEquals(1, state.depth());
    }

    // === Whitespace and Comments ===

    @Test
    void lineComment_isStyledAsComment() {
        var machine = OnlineParser.builder(TestGrammars.numberList())
                                  .lineComment("#")
                                  .build()
                                  .get();
        var state = machine.startState();
        var stream = LineStream.of("  [ # trailing", 2);

        assertEquals("ws", machine.token(stream, state));
        assertEquals("punctuation", machine.token(stream, state));
        assertEquals("ws", machine.token(stream, state));
        assertEquals("comment", machine.token(stream, state));
        assertTrue(stream.eol());
        assertEquals(1, state.step());
    }

    @Test
    void customWhitespace_treatsCommasAsIgnored() {
        var machine = OnlineParser.builder(TestGrammars.nestedValues())
                                  .whitespace(stream -> stream.eatWhile(c -> Character.isWhitespace(c) || c == ','))
                                  .build()
                                  .get();

        assertEquals(List.of("number", "number"), styles(machine, machine.startState(), "1,2"));
    }

    @Test
    void startOfLine_recomputesIndentLevel() {
        var machine = OnlineParser.builder(TestGrammars.nestedValues())
                                  .tabSize(2)
                                  .build()
                                  .get();
        var state = machine.startState();

        styles(machine, state, "    1");

        assertEquals(2, state.indentLevel());
    }
}
