package org.chatvault.archive.chunk;

/**
 * Optional capability of a log source: a name to label derived artifacts with.
 * <p>
 * A {@link Player} whose channel implements this interface labels the state it builds with
 * the file name; otherwise the label is empty.
 */
public interface NamedSource {

    /**
     * @return the name of the source, usually a file path
     */
    String name();
}
