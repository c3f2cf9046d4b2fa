/**
 * Signing and verification services
 *
 * This package contains Spring @Service classes for:
 * - Streaming SHA-256 digests of artifacts
 * - Key material resolution from literal, environment, file, identity and key store sources
 * - HMAC-SHA256 tag computation per signing profile
 * - Bare and structured signature sidecar files
 * - Constant-time verification of artifacts against sidecars
 */
package com.artifactintegrity.service;
