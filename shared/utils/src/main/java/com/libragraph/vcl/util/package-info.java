/**
 * Shared utilities for all VCL modules.
 *
 * <p>Contains {@link com.libragraph.vcl.util.ContentHash} (SHA-256) and
 * {@link com.libragraph.vcl.util.Checksums}. No framework dependencies, only Commons Codec.
 */
package com.libragraph.vcl.util;
