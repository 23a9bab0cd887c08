/**
 * Shared utilities for all VFS modules.
 *
 * <p>Contains {@link com.libragraph.vfs.util.VfsPaths}, the lexical path helpers used by
 * the document and physical layers alike. No framework dependencies.
 */
package com.libragraph.vfs.util;
