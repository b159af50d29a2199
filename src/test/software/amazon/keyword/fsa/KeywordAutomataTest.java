package software.amazon.keyword.fsa;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class KeywordAutomataTest {

    private static final int USHERS = 1;

    private static final StaticKeywordLibrary LIBRARY = StaticKeywordLibrary.builder()
            .addKeywords(USHERS, "he", "she", "his", "hers")
            .addKeywords(2, "abc")
            .addKeywords(3, "xy")
            .addKeywords(4, "a", "b", "c")
            .addKeywords(5, "ab")
            .addKeywords(6, "he", "she")
            .addType(7)
            .addKeyword(8, Keyword.of(0, "ok"))
            .addKeyword(8, Keyword.of(1, ""))
            .build();

    private static KeywordAutomata automata() {
        return KeywordAutomata.builder().withKeywordLibrary(LIBRARY).build();
    }

    private static KeywordAutomata automata(ArenaConfiguration configuration, TransitionMode mode) {
        return KeywordAutomata.builder()
                .withKeywordLibrary(LIBRARY)
                .withArenaConfiguration(configuration)
                .withTransitionMode(mode)
                .build();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void assertError(AutomatonError expected, Runnable action) {
        try {
            action.run();
            fail("expected " + expected);
        } catch (AutomatonException e) {
            assertEquals(expected, e.getError());
            assertEquals(expected.category(), e.getCategory());
        }
    }

    @Test
    public void testUshers() {
        for (TransitionMode mode : TransitionMode.values()) {
            KeywordAutomata automata = automata(ArenaConfiguration.builder().build(), mode);
            automata.build(USHERS);

            Matches matches = new Matches();
            assertTrue(automata.scan(USHERS, bytes("ushers"), matches));
            assertThat(mode.name(), matches.asList(), contains(new Match(1, 4), new Match(0, 4), new Match(3, 6)));
        }
    }

    @Test
    public void testScanWithoutMatches() {
        KeywordAutomata automata = automata();
        automata.build(USHERS);

        Matches matches = new Matches();
        assertFalse(automata.scan(USHERS, bytes("a quick brown fox"), matches));
        assertTrue(matches.isEmpty());
        assertFalse(automata.scan(USHERS, new byte[0], matches));
    }

    @Test
    public void testScanWithNullMatchesStillReportsOutcome() {
        KeywordAutomata automata = automata();
        automata.build(USHERS);

        assertTrue(automata.scan(USHERS, bytes("this"), (Matches) null));
        assertFalse(automata.scan(USHERS, bytes("that"), (Matches) null));
    }

    @Test
    public void testScansAppendToMatches() {
        KeywordAutomata automata = automata();
        automata.build(USHERS);

        Matches matches = new Matches();
        automata.scan(USHERS, bytes("he"), matches);
        automata.scan(USHERS, bytes("his"), matches);

        // every scan restarts at offset zero
        assertThat(matches.asList(), contains(new Match(0, 2), new Match(2, 3)));
    }

    @Test
    public void testScanToListener() {
        KeywordAutomata automata = automata();
        automata.build(USHERS);

        List<String> events = new ArrayList<>();
        automata.scan(USHERS, bytes("shis"), (keywordId, endOffset) -> events.add(keywordId + ":" + endOffset));
        assertEquals(Collections.singletonList("2:4"), events);
    }

    @Test
    public void testEmptyKeywordSetIsRejected() {
        KeywordAutomata automata = automata();

        assertError(AutomatonError.EMPTY_KEYWORD_SET, () -> automata.build(7));
        assertFalse(automata.isBuilt(7));
        assertTrue(automata.getArena().isEmpty());

        // nothing was registered, so the same error comes back rather than TYPE_ALREADY_BUILT
        assertError(AutomatonError.EMPTY_KEYWORD_SET, () -> automata.build(7));
        assertError(AutomatonError.NOT_BUILT, () -> automata.teardown(7));
    }

    @Test
    public void testUnknownTypeAndEmptyKeyword() {
        KeywordAutomata automata = automata();

        assertError(AutomatonError.UNKNOWN_TYPE, () -> automata.build(99));
        assertError(AutomatonError.EMPTY_KEYWORD, () -> automata.build(8));
        assertTrue(automata.getArena().isEmpty());
        assertThat(automata.builtTypes(), is(empty()));
    }

    @Test
    public void testUseBeforeBuild() {
        KeywordAutomata automata = automata();

        assertError(AutomatonError.NOT_BUILT, () -> automata.scan(USHERS, bytes("ushers"), new Matches()));
        assertError(AutomatonError.NOT_BUILT, () -> automata.newCursor(USHERS, new Matches()));
        assertError(AutomatonError.NOT_BUILT, () -> automata.getAutomaton(USHERS));
        assertError(AutomatonError.NOT_BUILT, () -> automata.teardown(USHERS));
    }

    @Test
    public void testNullInputIsCheckedFirst() {
        KeywordAutomata automata = automata();

        assertError(AutomatonError.NULL_INPUT, () -> automata.scan(USHERS, null, new Matches()));
        automata.build(USHERS);
        assertError(AutomatonError.NULL_INPUT, () -> automata.scan(USHERS, null, (Matches) null));
    }

    @Test
    public void testScanAfterTeardown() {
        KeywordAutomata automata = automata();
        Automaton automaton = automata.build(USHERS);
        ScanCursor cursor = automata.newCursor(USHERS, new Matches());

        automata.teardown(USHERS);

        assertFalse(automata.isBuilt(USHERS));
        assertTrue(automaton.isReleased());
        assertTrue(automata.getArena().isEmpty());
        assertError(AutomatonError.NOT_BUILT, () -> automata.scan(USHERS, bytes("ushers"), new Matches()));
        assertError(AutomatonError.NOT_BUILT, () -> cursor.scan(bytes("ushers")));
        assertError(AutomatonError.NOT_BUILT, automaton::root);
    }

    @Test
    public void testBuildingTwiceRequiresTeardown() {
        KeywordAutomata automata = automata();
        Automaton first = automata.build(USHERS);

        assertError(AutomatonError.TYPE_ALREADY_BUILT, () -> automata.build(USHERS));
        assertSame(first, automata.getAutomaton(USHERS));

        automata.teardown(USHERS);
        Automaton second = automata.build(USHERS);
        assertSame(second, automata.getAutomaton(USHERS));
        assertFalse(second.isReleased());
    }

    @Test
    public void testStateCapacityBoundary() {
        // "abc" needs the root plus three states
        KeywordAutomata tooSmall = automata(ArenaConfiguration.builder().withMaxStates(3).build(),
                TransitionMode.GOTO_FAILURE);
        try {
            tooSmall.build(2);
            fail("expected STATE_ARENA_EXHAUSTED");
        } catch (AutomatonException e) {
            assertEquals(AutomatonError.STATE_ARENA_EXHAUSTED, e.getError());
            assertEquals(ErrorCategory.RESOURCE_EXHAUSTION, e.getCategory());
            assertThat(e.getMessage(), containsString("E[014]MEM"));
            assertThat(e.getMessage(), containsString("maxStates"));
        }

        assertFalse(tooSmall.isBuilt(2));
        assertThat(tooSmall.builtTypes(), is(empty()));
        assertEquals(3, tooSmall.getArena().usedStates());
        assertError(AutomatonError.BUILD_INCOMPLETE, () -> tooSmall.scan(2, bytes("abc"), new Matches()));
        assertError(AutomatonError.TYPE_ALREADY_BUILT, () -> tooSmall.build(2));

        tooSmall.teardown(2);
        assertTrue(tooSmall.getArena().isEmpty());
        assertError(AutomatonError.NOT_BUILT, () -> tooSmall.scan(2, bytes("abc"), new Matches()));

        KeywordAutomata justRight = automata(ArenaConfiguration.builder().withMaxStates(4).build(),
                TransitionMode.GOTO_FAILURE);
        Automaton automaton = justRight.build(2);
        assertEquals(4, automaton.stateCount());
        assertEquals(0, justRight.getArena().availableStates());
        assertTrue(justRight.scan(2, bytes("xxabcxx"), new Matches()));
    }

    @Test
    public void testQueueCapacity() {
        // the three root children are all queued at once
        KeywordAutomata tooSmall = automata(ArenaConfiguration.builder().withMaxQueueElements(2).build(),
                TransitionMode.GOTO_FAILURE);
        assertError(AutomatonError.QUEUE_ARENA_EXHAUSTED, () -> tooSmall.build(4));
        tooSmall.teardown(4);
        assertTrue(tooSmall.getArena().isEmpty());

        KeywordAutomata justRight = automata(ArenaConfiguration.builder().withMaxQueueElements(3).build(),
                TransitionMode.GOTO_FAILURE);
        justRight.build(4);
        Matches matches = new Matches();
        justRight.scan(4, bytes("cab"), matches);
        assertThat(matches.asList(), contains(new Match(2, 1), new Match(0, 2), new Match(1, 3)));
    }

    @Test
    public void testTransitionCapacity() {
        // "ab" has two goto transitions; deterministic mode adds moves a->"a", b->"ab" from "a" and a->"a" from "ab"
        KeywordAutomata gotoOnly = automata(ArenaConfiguration.builder().withMaxTransitions(2).build(),
                TransitionMode.GOTO_FAILURE);
        assertEquals(2, gotoOnly.build(5).transitionCount());

        KeywordAutomata tooSmall = automata(ArenaConfiguration.builder().withMaxTransitions(4).build(),
                TransitionMode.DETERMINISTIC);
        assertError(AutomatonError.TRANSITION_ARENA_EXHAUSTED, () -> tooSmall.build(5));
        tooSmall.teardown(5);
        assertTrue(tooSmall.getArena().isEmpty());

        KeywordAutomata justRight = automata(ArenaConfiguration.builder().withMaxTransitions(5).build(),
                TransitionMode.DETERMINISTIC);
        assertEquals(5, justRight.build(5).transitionCount());
        Matches matches = new Matches();
        justRight.scan(5, bytes("aab"), matches);
        assertThat(matches.asList(), contains(new Match(0, 3)));
    }

    @Test
    public void testTransitionCapacityWhileEnteringKeywords() {
        KeywordAutomata tooSmall = automata(ArenaConfiguration.builder().withMaxTransitions(2).build(),
                TransitionMode.GOTO_FAILURE);
        assertError(AutomatonError.TRANSITION_ARENA_EXHAUSTED, () -> tooSmall.build(2));
        tooSmall.teardown(2);
        assertTrue(tooSmall.getArena().isEmpty());
    }

    @Test
    public void testOutputCapacity() {
        KeywordAutomata keywordOutputs = automata(ArenaConfiguration.builder().withMaxOutputs(1).build(),
                TransitionMode.GOTO_FAILURE);
        assertError(AutomatonError.KEYWORD_OUTPUT_EXHAUSTED, () -> keywordOutputs.build(4));
        keywordOutputs.teardown(4);
        assertTrue(keywordOutputs.getArena().isEmpty());

        // "she" inherits "he", which needs a third cell
        KeywordAutomata failureOutputs = automata(ArenaConfiguration.builder().withMaxOutputs(2).build(),
                TransitionMode.GOTO_FAILURE);
        assertError(AutomatonError.FAILURE_OUTPUT_EXHAUSTED, () -> failureOutputs.build(6));
        failureOutputs.teardown(6);
        assertTrue(failureOutputs.getArena().isEmpty());

        KeywordAutomata justRight = automata(ArenaConfiguration.builder().withMaxOutputs(3).build(),
                TransitionMode.GOTO_FAILURE);
        assertEquals(3, justRight.build(6).outputCount());
    }

    @Test
    public void testTeardownReturnsCapacityToOtherTypes() {
        KeywordAutomata automata = automata(ArenaConfiguration.builder().withMaxStates(4).build(),
                TransitionMode.GOTO_FAILURE);
        automata.build(2);
        assertError(AutomatonError.STATE_ARENA_EXHAUSTED, () -> automata.build(3));
        automata.teardown(3);
        assertTrue(automata.isBuilt(2));

        automata.teardown(2);
        automata.build(3);
        assertThat(automata.builtTypes(), contains(3));
        assertEquals(3, automata.getArena().usedStates());

        Matches matches = new Matches();
        assertTrue(automata.scan(3, bytes("xyxy"), matches));
        assertThat(matches.asList(), contains(new Match(0, 2), new Match(0, 4)));
    }

    @Test
    public void testSeveralTypesShareTheArena() {
        KeywordAutomata automata = automata();
        automata.build(USHERS);
        automata.build(2);
        automata.build(4);

        assertThat(automata.builtTypes(), contains(USHERS, 2, 4));
        Matches matches = new Matches();
        automata.scan(2, bytes("she sells abc"), matches);
        assertThat(matches.asList(), contains(new Match(0, 13)));

        automata.teardown(2);
        matches.clear();
        automata.scan(USHERS, bytes("she sells abc"), matches);
        assertThat(matches.asList(), contains(new Match(1, 3), new Match(0, 3)));

        automata.teardown(USHERS);
        automata.teardown(4);
        assertTrue(automata.getArena().isEmpty());
    }

    @Test
    public void testIdempotentRebuild() {
        for (TransitionMode mode : TransitionMode.values()) {
            KeywordAutomata automata = automata(ArenaConfiguration.builder().build(), mode);
            Random random = new Random(17);
            List<byte[]> inputs = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                inputs.add(randomText(random, 64, "hersi "));
            }

            Automaton first = automata.build(USHERS);
            List<List<Match>> before = scanAll(automata, inputs);
            int states = first.stateCount();
            int transitions = first.transitionCount();
            automata.teardown(USHERS);

            Automaton second = automata.build(USHERS);
            assertEquals(before, scanAll(automata, inputs));
            assertEquals(states, second.stateCount());
            assertEquals(transitions, second.transitionCount());
        }
    }

    @Test
    public void testConcurrentScans() throws Exception {
        KeywordAutomata automata = automata();
        automata.build(USHERS);

        Random random = new Random(42);
        List<byte[]> inputs = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            inputs.add(randomText(random, 256, "hers "));
        }
        List<List<Match>> expected = scanAll(automata, inputs);

        ExecutorService exec = Executors.newFixedThreadPool(8);
        try {
            List<Callable<List<List<Match>>>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> scanAll(automata, inputs));
            }
            for (Future<List<List<Match>>> result : exec.invokeAll(tasks)) {
                assertEquals(expected, result.get());
            }
        } finally {
            exec.shutdown();
            assertTrue(exec.awaitTermination(30, TimeUnit.SECONDS));
        }
    }

    @Test
    public void testCaseInsensitive() {
        KeywordAutomata automata = KeywordAutomata.builder()
                .withKeywordLibrary(LIBRARY)
                .withCaseInsensitive(true)
                .build();
        automata.build(USHERS);

        Matches matches = new Matches();
        assertTrue(automata.scan(USHERS, bytes("UsHeRs"), matches));
        assertThat(matches.asList(), contains(new Match(1, 4), new Match(0, 4), new Match(3, 6)));

        assertFalse(automata().isCaseInsensitive());
    }

    @Test
    public void testBuilderRequiresLibrary() {
        try {
            KeywordAutomata.builder().build();
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("keyword library"));
        }
    }

    private static List<List<Match>> scanAll(KeywordAutomata automata, List<byte[]> inputs) {
        List<List<Match>> results = new ArrayList<>();
        for (byte[] input : inputs) {
            Matches matches = new Matches();
            automata.scan(USHERS, input, matches);
            results.add(matches.asList());
        }
        return results;
    }

    static byte[] randomText(Random random, int length, String alphabet) {
        byte[] text = new byte[length];
        for (int i = 0; i < length; i++) {
            text[i] = (byte) alphabet.charAt(random.nextInt(alphabet.length()));
        }
        return text;
    }

    @Test
    public void testToStringNamesBuiltTypes() {
        KeywordAutomata automata = automata();
        automata.build(USHERS);
        automata.build(4);
        assertThat(automata.toString(), containsString("builtTypes=[1, 4]"));
        assertThat(automata.toString(), containsString("GOTO_FAILURE"));
    }
}
