package dev.brainlift.graph;

/** A node failed and the workflow run was aborted. */
public class WorkflowException extends RuntimeException {

  private final String nodeName;

  public WorkflowException(String nodeName, Throwable cause) {
    super("Workflow node '" + nodeName + "' failed: " + cause.getMessage(), cause);
    this.nodeName = nodeName;
  }

  public String nodeName() {
    return nodeName;
  }
}
