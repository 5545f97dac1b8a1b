package com.sandguard.sandbox;

/**
 * Finds an executable by name.
 */
@FunctionalInterface
public interface ExecutableLookup {

    /**
     * @return the absolute path of the executable, or null if it is not found
     */
    String find(String name);
}
