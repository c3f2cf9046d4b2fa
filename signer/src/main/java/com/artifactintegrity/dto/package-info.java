/**
 * Value types passed between the signing services
 *
 * This package contains:
 * - KeySource and KeyMaterial for key selection and in-memory key handling
 * - ArtifactDigest and IntegrityTag hex values
 * - SignatureRecord, the JSON form of a structured sidecar
 */
package com.artifactintegrity.dto;
