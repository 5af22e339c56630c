/**
 * Pure Java value types shared across all VCL modules.
 *
 * <p>Enums here are persisted by their numeric {@code id()}; never renumber an existing constant.
 * This module has no dependencies.
 */
package com.libragraph.vcl.types;
