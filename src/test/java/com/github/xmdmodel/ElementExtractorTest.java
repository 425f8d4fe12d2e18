package com.github.xmdmodel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.xmdmodel.SimpleXmdNode.SimpleXmdNodeBuilder;
import com.github.xmdmodel.XmdParseException.Code;

/**
 * Tests for identifier, flag and name extraction.
 */
public class ElementExtractorTest {

  @Test
  public void testStateWithoutPropertiesHasNoFlags() throws XmdParseException {
    final State state =
        ElementExtractor.extractState(SimpleXmdNodeBuilder.element("state").attribute("id", "4")
            .build());
    assertEquals(4, state.getId());
    assertFalse(state.isInitial());
    assertFalse(state.isMarked());
    assertFalse(state.getName().isPresent());
  }

  @Test
  public void testStateInitialOnly() throws XmdParseException {
    final State state = ElementExtractor.extractState(SimpleXmdNodeBuilder.element("state")
        .attribute("id", "0")
        .child(SimpleXmdNodeBuilder.element("properties")
            .child(SimpleXmdNodeBuilder.element("initial")))
        .build());
    assertTrue(state.isInitial());
    assertFalse(state.isMarked());
  }

  @Test
  public void testStateFlagsAndName() throws XmdParseException {
    final State state = ElementExtractor.extractState(SimpleXmdNodeBuilder.element("state")
        .attribute("id", "12")
        .child(SimpleXmdNodeBuilder.element("properties").text(" ")
            .child(SimpleXmdNodeBuilder.element("marked")).text(" ")
            .child(SimpleXmdNodeBuilder.element("initial")))
        .child(SimpleXmdNodeBuilder.element("name").text("  idle \n"))
        .build());
    assertEquals(12, state.getId());
    assertTrue(state.isInitial());
    assertTrue(state.isMarked());
    assertEquals("idle", state.getName().get());
  }

  @Test
  public void testEventFlags() throws XmdParseException {
    final Event event = ElementExtractor.extractEvent(SimpleXmdNodeBuilder.element("event")
        .attribute("id", "3")
        .child(SimpleXmdNodeBuilder.element("properties")
            .child(SimpleXmdNodeBuilder.element("observable")))
        .child(SimpleXmdNodeBuilder.element("name").text("start"))
        .build());
    assertEquals(3, event.getId());
    assertFalse(event.isControllable());
    assertTrue(event.isObservable());
    assertEquals("start", event.getName().get());
  }

  @Test
  public void testFlagsOutsidePropertiesAreNotFlags() throws XmdParseException {
    final Event event = ElementExtractor.extractEvent(SimpleXmdNodeBuilder.element("event")
        .attribute("id", "1").child(SimpleXmdNodeBuilder.element("controllable")).build());
    assertFalse(event.isControllable());
  }

  @Test
  public void testTransitionAttributeOrderDoesNotMatter() throws XmdParseException {
    final Transition transition = ElementExtractor.extractTransition(SimpleXmdNodeBuilder
        .element("transition").attribute("event", "3").attribute("target", "2")
        .attribute("id", "7").attribute("source", "1").build());
    assertEquals(new Transition(7, 1, 2, 3), transition);
  }

  @Test
  public void testIdentifierWhitespaceIsTrimmed() throws XmdParseException {
    assertEquals(42, ElementExtractor.parseIdentifier(
        SimpleXmdNodeBuilder.element("state").attribute("id", " 42 ").build(), "id"));
  }

  @Test
  public void testMalformedIdentifiers() {
    final String[] badValues = {"", "  ", "abc", "-1", "+1", "1.5", "1e3", "0x10", "99999999999"};
    for (final String badValue : badValues) {
      try {
        ElementExtractor.parseIdentifier(
            SimpleXmdNodeBuilder.element("state").attribute("id", badValue).build(), "id");
        fail("Expected MALFORMED_IDENTIFIER for '" + badValue + "'");
      } catch (XmdParseException expected) {
        assertEquals(Code.MALFORMED_IDENTIFIER, expected.getCode());
      }
    }
  }

  @Test
  public void testMissingTransitionEndpoint() {
    try {
      ElementExtractor.extractTransition(SimpleXmdNodeBuilder.element("transition")
          .attribute("id", "0").attribute("source", "0").attribute("event", "0").build());
      fail("Expected MALFORMED_IDENTIFIER for missing target");
    } catch (XmdParseException expected) {
      assertEquals(Code.MALFORMED_IDENTIFIER, expected.getCode());
      assertTrue(expected.getMessage().contains("'target'"));
    }
  }

}
