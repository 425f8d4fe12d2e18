package com.github.xmdmodel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.github.xmdmodel.SimpleXmdNode.SimpleXmdNodeBuilder;
import com.github.xmdmodel.XmdParser.XmdParserBuilder;

/**
 * Feeds the parser a hand-made tree instead of a DOM.
 */
public class SimpleXmdNodeTest {

  @Test
  public void testParseHandMadeTree() throws XmdParseException {
    final SimpleXmdNode model = SimpleXmdNodeBuilder.element("model")
        .child(SimpleXmdNodeBuilder.element("data").text("\n")
            .child(SimpleXmdNodeBuilder.element("state").attribute("id", "0")
                .child(SimpleXmdNodeBuilder.element("properties")
                    .child(SimpleXmdNodeBuilder.element("initial"))))
            .text("\n")
            .child(SimpleXmdNodeBuilder.element("state").attribute("id", "1"))
            .child(SimpleXmdNodeBuilder.element("event").attribute("id", "0")
                .child(SimpleXmdNodeBuilder.element("properties")
                    .child(SimpleXmdNodeBuilder.element("controllable"))))
            .child(SimpleXmdNodeBuilder.element("transition").attribute("id", "0")
                .attribute("source", "0").attribute("target", "1").attribute("event", "0")))
        .build();

    final XmdModel parsed = XmdParserBuilder.newBuilder().build()
        .parse(SimpleXmdNode.document(model));
    assertEquals(2, parsed.getNumStates());
    assertEquals(1, parsed.getNumEvents());
    assertEquals(1, parsed.getNumTransitions());
    assertTrue(parsed.getStates().get(0).isInitial());
    assertTrue(parsed.getEvents().get(0).isControllable());
    assertEquals(new Transition(0, 0, 1, 0), parsed.getTransitions().get(0));
  }

  @Test
  public void testTextContentConcatenatesDescendants() {
    final SimpleXmdNode name = SimpleXmdNodeBuilder.element("name").text("ab")
        .child(SimpleXmdNodeBuilder.element("b").text("cd")).build();
    assertEquals("abcd", name.getTextContent().get());
    assertFalse(SimpleXmdNodeBuilder.element("name").build().getTextContent().isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBlankTagRejected() {
    SimpleXmdNodeBuilder.element(" ");
  }

}
