package keyseal;

import keyseal.benchmark.BenchmarkResult;
import keyseal.benchmark.BenchmarkRunner;
import keyseal.benchmark.ResultPrinter;
import keyseal.crypto.AesGcmEncryptor;
import keyseal.crypto.AlgorithmSuite;
import keyseal.crypto.Suites;
import keyseal.keys.KeyDescriptor;
import keyseal.keys.KeySet;
import keyseal.model.Envelope;
import keyseal.model.EnvelopeJson;
import keyseal.sealer.Sealer;
import keyseal.unsealer.Unsealer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the key-sealed envelope demo.
 *
 * Runs two phases:
 * 1. Smoke test: seal → JSON → parse → unseal for each suite, with two recipients
 * 2. Benchmark: measures timing and sizes across all suites
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final int BENCHMARK_ITERATIONS = 100;
    private static final int PAYLOAD_BYTES = 16 * 1024;

    public static void main(String[] args) {
        System.out.println("=".repeat(60));
        System.out.println("  KEY-SEALED ENVELOPE");
        System.out.println("=".repeat(60));

        int iterations = parseIterations(args);

        System.out.println("\nContent cipher: " + new AesGcmEncryptor().algorithmName());
        System.out.println("\n--- Smoke Test ---");
        boolean allPassed = true;
        for (AlgorithmSuite suite : Suites.all()) {
            allPassed &= smokeTest(suite);
        }
        if (!allPassed) {
            System.exit(1);
        }

        System.out.println("\n--- Benchmark ---");
        byte[] payload = samplePayload(PAYLOAD_BYTES);
        BenchmarkRunner runner = new BenchmarkRunner(iterations);
        List<BenchmarkResult> results = new ArrayList<>();
        for (AlgorithmSuite suite : Suites.all()) {
            System.out.println("Benchmarking " + suite.name() + "...");
            results.add(runner.run(suite, payload));
        }

        ResultPrinter.printTable(results, iterations);
    }

    /** Benchmark iteration count from the first argument; falls back to the default unless positive. */
    static int parseIterations(String[] args) {
        if (args.length == 0) {
            return BENCHMARK_ITERATIONS;
        }
        try {
            int iterations = Integer.parseInt(args[0]);
            if (iterations > 0) {
                return iterations;
            }
        } catch (NumberFormatException e) {
            logger.debug("Iteration count '{}' is not a number", args[0], e);
        }
        logger.warn("Ignoring invalid iteration count '{}', using {}", args[0], BENCHMARK_ITERATIONS);
        return BENCHMARK_ITERATIONS;
    }

    /**
     * Seal for two recipients, send the envelope through its JSON form and open it as each of them.
     */
    static boolean smokeTest(AlgorithmSuite suite) {
        System.out.print(suite.name() + " [" + suite.signer().algorithmName() + ", "
                + suite.keyWrapper().algorithmName() + "] ... ");

        KeyDescriptor alice = KeyDescriptor.fromKeyPair("alice-1", suite.signer().generateKeyPair());
        KeyDescriptor bob = KeyDescriptor.fromKeyPair("bob-1", suite.keyWrapper().generateRecipientKeyPair());
        KeyDescriptor carol = KeyDescriptor.fromKeyPair("carol-1", suite.keyWrapper().generateRecipientKeyPair());
        String message = "hello from " + suite.name();

        try {
            Sealer sealer = Sealer.create(alice, KeySet.of(bob, carol).toPublic());
            Envelope envelope = sealer.seal(message, List.of("bob-1", "carol-1"));
            String wire = EnvelopeJson.toJson(envelope);

            for (KeyDescriptor recipient : List.of(bob, carol)) {
                Unsealer unsealer = Unsealer.create(recipient, List.of(alice.toPublic()));
                byte[] opened = unsealer.unseal(EnvelopeJson.fromJson(wire));
                if (!message.equals(new String(opened, StandardCharsets.UTF_8))) {
                    System.out.println("FAILED: payload mismatch for " + recipient.kid());
                    return false;
                }
            }
            System.out.println("OK (" + wire.length() + " byte envelope, both recipients decrypted)");
            return true;
        } catch (EnvelopeException e) {
            System.out.println("FAILED: " + e.reason() + " " + e.getMessage());
            logger.error("Smoke test failed for {}", suite.name(), e);
            return false;
        }
    }

    static byte[] samplePayload(int length) {
        byte[] payload = new byte[length];
        for (int i = 0; i < length; i++) {
            payload[i] = (byte) (i * 31 + 7);
        }
        return payload;
    }
}
