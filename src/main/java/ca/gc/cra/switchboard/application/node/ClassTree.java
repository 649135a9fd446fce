package ca.gc.cra.switchboard.application.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parent/child view of the registered classes, rooted at {@link NodeClass#ROOT_NAME}.
 *
 * @param name class name
 * @param children direct subclasses in registration order
 * @since 0.1.0
 */
public record ClassTree(String name, List<ClassTree> children) {
  /**
   * Validates and copies.
   */
  public ClassTree {
    Objects.requireNonNull(name, "name");
    children = List.copyOf(children);
  }

  /**
   * Finds a subtree by class name.
   *
   * @param className class to find
   * @return subtree, or {@code null} when the class is not part of this tree
   */
  public ClassTree find(String className) {
    if (name.equals(className)) {
      return this;
    }
    for (ClassTree child : children) {
      ClassTree match = child.find(className);
      if (match != null) {
        return match;
      }
    }
    return null;
  }

  /**
   * Renders the tree as indented lines, two spaces per level.
   *
   * @return lines suitable for console output
   */
  public List<String> render() {
    List<String> lines = new ArrayList<>();
    render(0, lines);
    return lines;
  }

  private void render(int depth, List<String> lines) {
    lines.add("  ".repeat(depth) + name);
    for (ClassTree child : children) {
      child.render(depth + 1, lines);
    }
  }
}
