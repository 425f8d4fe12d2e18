package com.github.xmdmodel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Optional;

import org.junit.Test;

import com.github.xmdmodel.XmdParseException.Code;

/**
 * Tests for the accumulate-then-finalize lifecycle and integrity checks.
 */
public class ModelBuilderTest {

  @Test
  public void testBuildKeepsInsertionOrderAndCounts() throws XmdParseException {
    final ModelBuilder builder = new ModelBuilder(IntegrityMode.STRICT);
    final State s0 = new State(0, Optional.of("a"), true, false);
    final State s1 = new State(1, Optional.<String>empty(), false, true);
    final Event e0 = new Event(0, Optional.of("go"), true, true);
    final Transition t0 = new Transition(0, 0, 1, 0);
    builder.addState(s0).addEvent(e0).addTransition(t0).addState(s1);
    assertFalse(builder.isFinalized());

    final XmdModel model = builder.build();
    assertTrue(builder.isFinalized());
    assertEquals(2, model.getNumStates());
    assertEquals(1, model.getNumEvents());
    assertEquals(1, model.getNumTransitions());
    assertSame(s0, model.getStates().get(0));
    assertSame(s1, model.getStates().get(1));
    assertSame(s0, model.sourceOf(t0).get());
    assertSame(s1, model.targetOf(t0).get());
    assertSame(e0, model.eventOf(t0).get());
    assertFalse(model.getSourceFile().isPresent());
  }

  @Test
  public void testNoMutationAfterFinalization() throws XmdParseException {
    final ModelBuilder builder = new ModelBuilder(IntegrityMode.PERMISSIVE);
    builder.build();
    try {
      builder.addState(new State(0, Optional.<String>empty(), false, false));
      fail("Expected BUILDER_FINALIZED");
    } catch (XmdParseException expected) {
      assertEquals(Code.BUILDER_FINALIZED, expected.getCode());
    }
    try {
      builder.build();
      fail("Expected BUILDER_FINALIZED");
    } catch (XmdParseException expected) {
      assertEquals(Code.BUILDER_FINALIZED, expected.getCode());
    }
  }

  @Test
  public void testStrictReportsEveryViolation() throws XmdParseException {
    final ModelBuilder builder = new ModelBuilder(IntegrityMode.STRICT);
    builder.addState(new State(0, Optional.<String>empty(), true, false));
    builder.addState(new State(0, Optional.<String>empty(), false, false));
    builder.addEvent(new Event(5, Optional.<String>empty(), false, false));
    builder.addTransition(new Transition(0, 0, 9, 6));
    assertEquals(3, builder.findIntegrityViolations().size());
    try {
      builder.build();
      fail("Expected INTEGRITY_VIOLATION");
    } catch (XmdParseException expected) {
      assertEquals(Code.INTEGRITY_VIOLATION, expected.getCode());
      assertTrue(expected.getMessage().contains("duplicate state id 0"));
      assertTrue(expected.getMessage().contains("unknown target state 9"));
      assertTrue(expected.getMessage().contains("unknown event 6"));
    }
    assertTrue(builder.isFinalized());
  }

  @Test
  public void testPermissiveKeepsDuplicatesAndDanglingReferences() throws XmdParseException {
    final ModelBuilder builder = new ModelBuilder(IntegrityMode.PERMISSIVE);
    final State first = new State(0, Optional.of("first"), true, false);
    builder.addState(first);
    builder.addState(new State(0, Optional.of("second"), false, false));
    builder.addTransition(new Transition(0, 0, 3, 1));
    final XmdModel model = builder.build();
    assertEquals(2, model.getNumStates());
    assertSame(first, model.findState(0).get());
    assertFalse(model.targetOf(model.getTransitions().get(0)).isPresent());
    assertFalse(model.eventOf(model.getTransitions().get(0)).isPresent());
  }

}
