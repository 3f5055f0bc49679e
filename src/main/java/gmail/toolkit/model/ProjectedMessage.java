package gmail.toolkit.model;

/**
 * A message reduced to one of the {@link Format} shapes. Each format has its own implementation
 * carrying exactly the fields of that shape.
 */
public interface ProjectedMessage {
    String getId();

    String getThreadId();
}
