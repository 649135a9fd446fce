package ca.gc.cra.switchboard.application.node;

import ca.gc.cra.switchboard.domain.node.Domain;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stores node classes by name and validates their contracts at registration.
 * <p><strong>Why:</strong> A class that leaves a required handler unimplemented must fail at boot, with every
 * violation listed, instead of failing later in the middle of live message flow.</p>
 * <p><strong>Role:</strong> Node model registry owned by one bus.</p>
 * <p><strong>Thread-safety:</strong> Methods synchronize on the registry.</p>
 * <p><strong>Observability:</strong> Logs contract violations at error and registrations at debug.</p>
 *
 * @since 0.1.0
 */
public final class NodeClassRegistry {
  private static final Logger log = LoggerFactory.getLogger(NodeClassRegistry.class);

  private final Map<String, NodeClass> classes = new LinkedHashMap<>();

  /**
   * Creates a registry holding only the root class.
   */
  public NodeClassRegistry() {
    classes.put(NodeClass.ROOT_NAME, NodeClass.root());
  }

  /**
   * Validates and stores a class.
   *
   * @param nodeClass class to register
   * <p>The parent is followed by reference, so an intermediate class that only declares requirements for its
   * descendants never needs registering.</p>
   *
   * @throws DuplicateNodeClassException when the name is already registered
   * @throws ContractViolationException when required handlers have no implementation and no default
   */
  public synchronized void register(NodeClass nodeClass) {
    Objects.requireNonNull(nodeClass, "nodeClass");
    String name = nodeClass.name();
    if (classes.containsKey(name)) {
      throw new DuplicateNodeClassException(name);
    }
    NodeClass parent = nodeClass.parent().orElseThrow(() -> new DuplicateNodeClassException(name));

    List<RequiredHandler> missing = new ArrayList<>();
    for (RequiredHandler required : nodeClass.requiredHandlers()) {
      if (!nodeClass.implementsHandler(required.channel(), required.handler())) {
        missing.add(required);
      }
    }
    if (!missing.isEmpty()) {
      ContractViolationException violation = new ContractViolationException(name, missing);
      log.error("{}", violation.getMessage());
      throw violation;
    }

    classes.put(name, nodeClass);
    log.debug("Registered node class {} (domain={}, parent={})", name, nodeClass.domain(), parent.name());
  }

  /**
   * Looks up a class.
   *
   * @param className class name
   * @return registered class
   * @throws UnknownNodeClassException when the class is not registered
   */
  public synchronized NodeClass resolve(String className) {
    NodeClass nodeClass = classes.get(className);
    if (nodeClass == null) {
      throw new UnknownNodeClassException(className);
    }
    return nodeClass;
  }

  /**
   * Looks up a class without failing.
   *
   * @param className class name
   * @return class, or empty when unregistered
   */
  public synchronized Optional<NodeClass> find(String className) {
    return Optional.ofNullable(classes.get(className));
  }

  public synchronized boolean isRegistered(String className) {
    return classes.containsKey(className);
  }

  /**
   * Returns the domain tag stored for a class.
   *
   * @param className class name
   * @return domain, or empty when unregistered
   */
  public synchronized Optional<Domain> domainOf(String className) {
    NodeClass nodeClass = classes.get(className);
    return nodeClass == null ? Optional.empty() : Optional.of(nodeClass.domain());
  }

  /**
   * Registered class names in registration order, root first.
   *
   * @return immutable list of names
   */
  public synchronized List<String> classNames() {
    return List.copyOf(classes.keySet());
  }

  /**
   * Ensures every expected class is registered.
   *
   * @param expected class names the caller depends on
   * @throws UnknownNodeClassException naming every missing class
   */
  public synchronized void verify(Collection<String> expected) {
    List<String> missing = new ArrayList<>();
    for (String className : expected) {
      if (!classes.containsKey(className)) {
        missing.add(className);
      }
    }
    if (!missing.isEmpty()) {
      log.error("Missing node classes: {}", missing);
      throw UnknownNodeClassException.missing(missing);
    }
  }

  /**
   * Returns the ancestry of a class, root first.
   *
   * @param className class name
   * @return immutable chain ending with {@code className}
   * @throws UnknownNodeClassException when the class is not registered
   */
  public synchronized List<String> chain(String className) {
    return resolve(className).ancestry();
  }

  /**
   * Builds the inheritance tree of the registered classes.
   *
   * @return tree rooted at {@link NodeClass#ROOT_NAME}
   */
  public synchronized ClassTree inheritanceTree() {
    return subtree(NodeClass.ROOT_NAME);
  }

  private ClassTree subtree(String className) {
    List<ClassTree> children = new ArrayList<>();
    for (NodeClass candidate : classes.values()) {
      if (!candidate.isRoot() && nearestRegisteredAncestor(candidate).equals(className)) {
        children.add(subtree(candidate.name()));
      }
    }
    return new ClassTree(className, children);
  }

  private String nearestRegisteredAncestor(NodeClass nodeClass) {
    NodeClass current = nodeClass.parent().orElseThrow();
    while (!classes.containsKey(current.name())) {
      current = current.parent().orElseThrow();
    }
    return current.name();
  }
}
