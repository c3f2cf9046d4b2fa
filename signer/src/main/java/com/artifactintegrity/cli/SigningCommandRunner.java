package com.artifactintegrity.cli;

import com.artifactintegrity.dto.KeySource;
import com.artifactintegrity.entity.ArtifactType;
import com.artifactintegrity.entity.SignatureVariant;
import com.artifactintegrity.exception.ArtifactIntegrityException;
import com.artifactintegrity.exception.KeyUnavailableException;
import com.artifactintegrity.exception.SignatureFormatException;
import com.artifactintegrity.service.ArtifactSigningService;
import com.artifactintegrity.service.ArtifactVerificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line surface of the signer.
 *
 * <pre>
 * sign-package  &lt;artifact&gt; [--out=PATH] [--format=bare|structured] [key options]
 * sign-config   &lt;config&gt; [--out=PATH] [--format=...] (--key=|--key-env=|--key-file=|--key-alias=)
 * sign-identity &lt;config&gt; --device-id=ID --package-name=NAME [--out=PATH] [--format=...]
 * sign-batch    &lt;artifact&gt;... --type=package|config [--format=...] [key options]
 * verify        &lt;artifact&gt; --type=package|config --signature=PATH [--format=...] (key options)
 * </pre>
 *
 * Key options are mutually exclusive. {@code sign-package} falls back to a generated key
 * when none is given. Exit codes: 0 success or match, 1 tamper, 2 key unavailable,
 * 3 I/O error, 4 format error, 64 usage error, 70 unexpected internal failure.
 * Without {@code --format}, {@code verify} detects the sidecar variant from its content.
 */
@Component
public class SigningCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SigningCommandRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_TAMPER = 1;
    public static final int EXIT_KEY_UNAVAILABLE = 2;
    public static final int EXIT_IO_ERROR = 3;
    public static final int EXIT_FORMAT_ERROR = 4;
    public static final int EXIT_USAGE = 64;
    public static final int EXIT_SOFTWARE = 70;

    private static final String USAGE = "Usage: signer <sign-package|sign-config|sign-identity|sign-batch|verify> "
        + "<artifact> [--out=PATH] [--format=bare|structured] [--type=package|config] [--signature=PATH] "
        + "[--key=VALUE | --key-env=NAME | --key-file=PATH | --key-alias=ALIAS | --device-id=ID --package-name=NAME]";

    private final ArtifactSigningService signingService;
    private final ArtifactVerificationService verificationService;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public SigningCommandRunner(ArtifactSigningService signingService,
                                ArtifactVerificationService verificationService) {
        this(signingService, verificationService, System.out);
    }

    SigningCommandRunner(ArtifactSigningService signingService,
                         ArtifactVerificationService verificationService,
                         PrintStream out) {
        this.signingService = signingService;
        this.verificationService = verificationService;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Run one command and return its exit code. Never throws.
     */
    public int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            logger.info(USAGE);
            return EXIT_USAGE;
        }
        String command = positional.get(0);
        try {
            switch (command) {
                case "sign-package":
                    return signOne(args, ArtifactType.PACKAGE, resolveKeySource(args, true, true));
                case "sign-config":
                    return signOne(args, ArtifactType.CONFIGURATION, resolveKeySource(args, false, false));
                case "sign-identity":
                    return signOne(args, ArtifactType.CONFIGURATION, resolveIdentityKeySource(args));
                case "sign-batch":
                    return signBatch(args);
                case "verify":
                    return verify(args);
                default:
                    throw new IllegalArgumentException("Unknown command: " + command);
            }
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            logger.info(USAGE);
            return EXIT_USAGE;
        } catch (ArtifactIntegrityException e) {
            logger.error("{} failed{}: {}", command, e.getPath() != null ? " for " + e.getPath() : "", e.getMessage());
            return exitCodeFor(e);
        } catch (RuntimeException e) {
            // Exit status 1 is reserved for tamper
            logger.error("{} failed unexpectedly", command, e);
            return EXIT_SOFTWARE;
        }
    }

    // ==================== Commands ====================

    private int signOne(ApplicationArguments args, ArtifactType artifactType, KeySource keySource) {
        Path artifact = requireArtifact(args);
        Path destination = optionalPath(args, "out");
        ArtifactSigningService.SigningResult result =
            signingService.sign(artifact, artifactType, keySource, destination, optionalVariant(args));
        out.println(result.getDestination());
        return EXIT_OK;
    }

    private int signBatch(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() < 2) {
            throw new IllegalArgumentException("At least one artifact path is required");
        }
        if (args.containsOption("out")) {
            throw new IllegalArgumentException("--out is not supported for sign-batch");
        }
        ArtifactType artifactType = ArtifactType.fromCliName(requireOption(args, "type"));
        KeySource keySource = resolveKeySource(args, artifactType == ArtifactType.PACKAGE, true);

        List<Path> artifacts = new ArrayList<>();
        for (String path : positional.subList(1, positional.size())) {
            artifacts.add(Paths.get(path));
        }

        ArtifactSigningService.BatchSigningResult result =
            signingService.signBatch(artifacts, artifactType, keySource, optionalVariant(args));
        for (ArtifactSigningService.SigningResult signed : result.getSuccessfulResults()) {
            out.println(signed.getDestination());
        }
        if (result.getFailureCount() > 0) {
            return exitCodeFor(result.getFailedResults().get(0).getError());
        }
        return EXIT_OK;
    }

    private int verify(ApplicationArguments args) {
        Path artifact = requireArtifact(args);
        ArtifactType artifactType = ArtifactType.fromCliName(requireOption(args, "type"));
        Path signature = Paths.get(requireOption(args, "signature"));
        KeySource keySource = resolveKeySource(args, false, true);

        SignatureVariant variant = optionalVariant(args);

        ArtifactVerificationService.VerificationResult result =
            verificationService.verifyArtifact(artifact, artifactType, keySource, signature, variant);
        out.println(result.getOutcome());
        if (!result.isMatch()) {
            logger.warn("Verification of {} reported tampering: {}", result.getArtifactName(), result.getMessage());
            return EXIT_TAMPER;
        }
        return EXIT_OK;
    }

    // ==================== Argument Helpers ====================

    /**
     * Resolve exactly one key source from the options. More than one is a usage error.
     */
    private KeySource resolveKeySource(ApplicationArguments args, boolean allowGenerated, boolean allowIdentity) {
        List<KeySource> selected = new ArrayList<>();
        List<String> names = new ArrayList<>();
        if (args.containsOption("key")) {
            selected.add(KeySource.literal(singleValue(args, "key")));
            names.add("--key");
        }
        if (args.containsOption("key-env")) {
            selected.add(KeySource.environmentVariable(singleValue(args, "key-env")));
            names.add("--key-env");
        }
        if (args.containsOption("key-file")) {
            selected.add(KeySource.file(Paths.get(requireOption(args, "key-file"))));
            names.add("--key-file");
        }
        if (args.containsOption("key-alias")) {
            selected.add(KeySource.keyStoreAlias(singleValue(args, "key-alias")));
            names.add("--key-alias");
        }
        boolean identityRequested = args.containsOption("device-id") || args.containsOption("package-name");
        if (identityRequested) {
            if (!allowIdentity) {
                throw new IllegalArgumentException("--device-id/--package-name are not accepted here; use sign-identity");
            }
            selected.add(identityKeySource(args));
            names.add("--device-id/--package-name");
        }

        if (selected.size() > 1) {
            throw new IllegalArgumentException("Key options are mutually exclusive, got " + String.join(", ", names));
        }
        if (selected.isEmpty()) {
            if (allowGenerated) {
                logger.warn("No key option given; signing with a generated key that is discarded at exit. "
                    + "The tag cannot be verified later.");
                return KeySource.generated();
            }
            throw new IllegalArgumentException("One of --key, --key-env, --key-file or --key-alias is required");
        }
        return selected.get(0);
    }

    private KeySource resolveIdentityKeySource(ApplicationArguments args) {
        if (args.containsOption("key") || args.containsOption("key-env")
                || args.containsOption("key-file") || args.containsOption("key-alias")) {
            throw new IllegalArgumentException("sign-identity derives its key from --device-id and --package-name only");
        }
        return identityKeySource(args);
    }

    private KeySource identityKeySource(ApplicationArguments args) {
        String deviceId = args.containsOption("device-id") ? singleValue(args, "device-id") : null;
        String packageName = args.containsOption("package-name") ? singleValue(args, "package-name") : null;
        return KeySource.derivedFromIdentity(deviceId, packageName);
    }

    private Path requireArtifact(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() < 2) {
            throw new IllegalArgumentException("Artifact path is required");
        }
        if (positional.size() > 2) {
            throw new IllegalArgumentException("Only one artifact path may be given");
        }
        return Paths.get(positional.get(1));
    }

    private SignatureVariant optionalVariant(ApplicationArguments args) {
        if (!args.containsOption("format")) {
            return null;
        }
        String format = requireOption(args, "format");
        try {
            return SignatureVariant.valueOf(format.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown signature format: " + format);
        }
    }

    private Path optionalPath(ApplicationArguments args, String name) {
        return args.containsOption(name) ? Paths.get(requireOption(args, name)) : null;
    }

    private String requireOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        String value = singleValue(args, name);
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("--" + name + " requires a value");
        }
        return value;
    }

    private String singleValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " may only be given once");
        }
        return values.isEmpty() ? "" : values.get(0);
    }

    private static int exitCodeFor(ArtifactIntegrityException e) {
        if (e instanceof KeyUnavailableException) {
            return EXIT_KEY_UNAVAILABLE;
        }
        if (e instanceof SignatureFormatException) {
            return EXIT_FORMAT_ERROR;
        }
        return EXIT_IO_ERROR;
    }
}
