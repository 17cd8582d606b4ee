/**
 *
 */
package org.theseed.bng.model;

/**
 * Orientation of a surface molecule relative to its surface.  Volume molecules have no orientation.
 *
 */
public enum Orientation {
    DOWN, NONE, UP;
}
