/**
 * Command-line entry points for signing and verifying artifacts
 */
package com.artifactintegrity.cli;
