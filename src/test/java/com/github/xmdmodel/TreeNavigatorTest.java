package com.github.xmdmodel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Optional;

import org.junit.Test;

import com.github.xmdmodel.SimpleXmdNode.SimpleXmdNodeBuilder;

/**
 * Tests for the direct-child lookups.
 */
public class TreeNavigatorTest {

  @Test
  public void testFindChildReturnsFirstMatchInDocumentOrder() {
    final SimpleXmdNode first =
        SimpleXmdNodeBuilder.element("name").text("first").build();
    final SimpleXmdNode second =
        SimpleXmdNodeBuilder.element("name").text("second").build();
    final SimpleXmdNode parent = SimpleXmdNodeBuilder.element("state").text("\n  ")
        .child(SimpleXmdNodeBuilder.element("properties")).child(first).child(second).build();

    final Optional<XmdNode> found = TreeNavigator.findChild(parent, "name");
    assertTrue(found.isPresent());
    assertSame(first, found.get());
    assertEquals("first", found.get().getTextContent().get());
  }

  @Test
  public void testFindChildMissing() {
    final SimpleXmdNode parent = SimpleXmdNodeBuilder.element("state")
        .child(SimpleXmdNodeBuilder.element("properties")).build();
    assertFalse(TreeNavigator.findChild(parent, "name").isPresent());
    assertFalse(TreeNavigator.hasChild(parent, "name"));
  }

  @Test
  public void testAbsentParentPropagatesAbsence() {
    assertFalse(TreeNavigator.findChild((XmdNode) null, "data").isPresent());
    assertFalse(TreeNavigator.findChild(Optional.<XmdNode>empty(), "data").isPresent());
    assertFalse(TreeNavigator.hasChild((XmdNode) null, "initial"));
    assertFalse(TreeNavigator.hasChild(Optional.<XmdNode>empty(), "initial"));

    // chained lookups through a missing hop stay empty
    final SimpleXmdNode model = SimpleXmdNodeBuilder.element("model").build();
    assertFalse(TreeNavigator.findChild(TreeNavigator.findChild(model, "data"), "state")
        .isPresent());
  }

  @Test
  public void testOnlyDirectChildrenAreConsidered() {
    final SimpleXmdNode parent = SimpleXmdNodeBuilder.element("state")
        .child(SimpleXmdNodeBuilder.element("properties")
            .child(SimpleXmdNodeBuilder.element("initial")))
        .build();
    assertFalse(TreeNavigator.hasChild(parent, "initial"));
    assertTrue(TreeNavigator.hasChild(TreeNavigator.findChild(parent, "properties"), "initial"));
  }

  @Test
  public void testTextNodesNeverMatch() {
    final SimpleXmdNode parent =
        SimpleXmdNodeBuilder.element("data").text("state").build();
    assertFalse(TreeNavigator.hasChild(parent, SimpleXmdNode.TEXT_NODE_NAME));
    assertFalse(TreeNavigator.hasChild(parent, "state"));
  }

}
