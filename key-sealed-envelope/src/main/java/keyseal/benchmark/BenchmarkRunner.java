package keyseal.benchmark;

import keyseal.canonical.Canonicalizer;
import keyseal.crypto.AesGcmEncryptor;
import keyseal.crypto.AlgorithmSuite;
import keyseal.crypto.CommitmentCalculator;
import keyseal.keys.KeyDescriptor;
import keyseal.model.Envelope;
import keyseal.model.EnvelopeJson;
import keyseal.model.Util;
import keyseal.sealer.Sealer;
import keyseal.unsealer.Unsealer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the seal → unseal flow for a given algorithm suite, measuring wall-clock time for each
 * cryptographic phase as well as the complete {@link Sealer#seal} and {@link Unsealer#unseal} calls.
 */
public class BenchmarkRunner {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkRunner.class);

    private static final int WARMUP_ITERATIONS = 5;

    static final String SENDER_KID = "bench-sender";
    static final List<String> RECIPIENT_KIDS = List.of("bench-recipient-1", "bench-recipient-2");

    private final int iterations;

    public BenchmarkRunner(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
    }

    /**
     * Benchmark a single suite end-to-end.
     *
     * @param suite   the algorithm suite to measure
     * @param payload the plaintext (same across all suites for fair comparison)
     * @return aggregated results (median timings)
     */
    public BenchmarkResult run(AlgorithmSuite suite, byte[] payload) {
        // Pre-generate keys once (not part of per-operation timing)
        Keys keys = Keys.generate(suite);

        for (int i = 0; i < WARMUP_ITERATIONS; i++) {
            runSingleIteration(suite, payload, keys);
        }

        List<long[]> allTimings = new ArrayList<>();
        TimedRun first = null;
        for (int i = 0; i < iterations; i++) {
            TimedRun run = runSingleIteration(suite, payload, keys);
            allTimings.add(run.timings);
            if (first == null) {
                first = run;
            }
        }

        BenchmarkResult result = new BenchmarkResult(suite.name());
        List<String> metrics = BenchmarkResult.TIME_METRICS;
        for (int m = 0; m < metrics.size(); m++) {
            final int idx = m;
            result.recordTimeNanos(metrics.get(m), median(allTimings.stream().mapToLong(t -> t[idx]).sorted().toArray()));
        }

        // Sizes are constant across iterations
        result.recordSize("Signature", first.signatureBytes);
        result.recordSize("Payload", first.payloadBytes);
        result.recordSize("WrappedKey", first.wrappedKeyBytes);
        result.recordSize("Envelope", EnvelopeJson.toBytes(first.envelope).length);

        logger.debug("Benchmarked {} over {} iterations", suite.name(), iterations);
        return result;
    }

    /** Key material and role objects shared by every iteration of one suite. */
    private record Keys(KeyPair sender, KeyPair recipient, Sealer sealer, Unsealer unsealer) {

        static Keys generate(AlgorithmSuite suite) {
            KeyPair sender = suite.signer().generateKeyPair();
            KeyDescriptor senderJwk = KeyDescriptor.fromKeyPair(SENDER_KID, sender);
            List<KeyPair> recipients = new ArrayList<>();
            List<KeyDescriptor> recipientJwks = new ArrayList<>();
            for (String kid : RECIPIENT_KIDS) {
                KeyPair pair = suite.keyWrapper().generateRecipientKeyPair();
                recipients.add(pair);
                recipientJwks.add(KeyDescriptor.fromKeyPair(kid, pair));
            }
            Sealer sealer = Sealer.create(senderJwk, recipientJwks.stream().map(KeyDescriptor::toPublic).toList());
            Unsealer unsealer = Unsealer.create(recipientJwks.get(0), List.of(senderJwk.toPublic()));
            return new Keys(sender, recipients.get(0), sealer, unsealer);
        }
    }

    private record TimedRun(long[] timings, Envelope envelope, int signatureBytes, int payloadBytes, int wrappedKeyBytes) {}

    /**
     * Execute one complete seal → unseal flow, timing each phase.
     */
    private TimedRun runSingleIteration(AlgorithmSuite suite, byte[] payload, Keys keys) {
        try {
            return timeIteration(suite, payload, keys);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Benchmark iteration failed for " + suite.name(), e);
        }
    }

    private TimedRun timeIteration(AlgorithmSuite suite, byte[] payload, Keys keys) throws GeneralSecurityException {
        long[] t = new long[BenchmarkResult.TIME_METRICS.size()];
        int idx = 0;
        AesGcmEncryptor encryptor = new AesGcmEncryptor();
        CommitmentCalculator commitment = new CommitmentCalculator();

        // --- Sealing phases, primitives called directly ---
        long start = System.nanoTime();
        SecretKey cek = encryptor.generateKey();
        byte[] encrypted = encryptor.encrypt(payload, cek);
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        byte[] wrappedKey = suite.wrapKey(cek, keys.recipient.getPublic());
        t[idx++] = System.nanoTime() - start;

        Map<String, String> cekMap = new LinkedHashMap<>();
        cekMap.put(RECIPIENT_KIDS.get(0), Util.base64(wrappedKey));
        byte[] signedContent = Canonicalizer.canonicalBytes(
                Envelope.signedContent(SENDER_KID, cekMap, Util.base64(encrypted)));
        start = System.nanoTime();
        byte[] signature = suite.sign(signedContent, keys.sender.getPrivate());
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        byte[] ctx = commitment.commitment(encrypted);
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        Envelope envelope = keys.sealer.seal(payload, RECIPIENT_KIDS);
        t[idx++] = System.nanoTime() - start;

        // --- Unsealing phases ---
        start = System.nanoTime();
        boolean validSignature = suite.verify(signedContent, signature, keys.sender.getPublic());
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        byte[] recoveredKey = suite.unwrapKey(wrappedKey, keys.recipient.getPrivate());
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        boolean validCommitment = commitment.verify(encrypted, ctx);
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        byte[] decrypted = encryptor.decrypt(encrypted, encryptor.importKey(recoveredKey));
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        byte[] opened = keys.unsealer.unseal(envelope);
        t[idx++] = System.nanoTime() - start;

        if (!validSignature || !validCommitment || !Arrays.equals(decrypted, payload) || !Arrays.equals(opened, payload)) {
            throw new IllegalStateException("Round trip mismatch for " + suite.name());
        }
        return new TimedRun(t, envelope, signature.length, encrypted.length, wrappedKey.length);
    }

    static long median(long[] sorted) {
        int n = sorted.length;
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }
}
