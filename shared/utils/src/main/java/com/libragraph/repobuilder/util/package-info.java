/**
 * Shared utilities for all repobuilder modules.
 *
 * <p>Contains the digest engine ({@link com.libragraph.repobuilder.util.Md5Digest},
 * {@link com.libragraph.repobuilder.util.FileDigestTable},
 * {@link com.libragraph.repobuilder.util.DigestEngine}) and scoped temporaries.
 * No framework dependencies — pure Java.
 */
package com.libragraph.repobuilder.util;
