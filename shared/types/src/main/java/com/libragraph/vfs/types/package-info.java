/**
 * Pure Java value types shared across all VFS modules.
 *
 * <p>This module has no framework dependencies.
 */
package com.libragraph.vfs.types;
