/**
 * Pure Java value types shared across all repobuilder modules.
 *
 * <p>Package levels and file roles. Digests and path helpers live in
 * {@code shared/utils}. This module has no dependencies.
 */
package com.libragraph.repobuilder.types;
