package org.javai.springai.voltage.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.javai.springai.voltage.history.Turn;
import org.javai.springai.voltage.param.ParameterChange;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.simulation.CurvePoint;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * Signs and verifies {@link SessionState} instances.
 *
 * <p>The tag is an HMAC-SHA256 over a canonical JSON rendering of the state's content, keyed
 * with a secret that never leaves this instance. A state altered after signing, or signed by
 * another instance, fails verification.</p>
 */
public class StateFingerprinter {

	private static final String ALGORITHM = "HmacSHA256";
	private static final int KEY_LENGTH = 32;

	private final ObjectMapper mapper = new ObjectMapper();
	private final SecretKeySpec key;

	/**
	 * Creates a fingerprinter with a random key.
	 */
	public StateFingerprinter() {
		this(randomKey());
	}

	public StateFingerprinter(byte[] secret) {
		Objects.requireNonNull(secret, "secret must not be null");
		if (secret.length < 16) {
			throw new IllegalArgumentException("secret must be at least 16 bytes");
		}
		this.key = new SecretKeySpec(secret.clone(), ALGORITHM);
	}

	public SessionState sign(SessionState state) {
		return state.withFingerprint(fingerprint(state));
	}

	/**
	 * Check that a state carries the tag this instance would issue for its content.
	 */
	public boolean verify(SessionState state) {
		if (state.fingerprint() == null) {
			return false;
		}
		byte[] expected = fingerprint(state).getBytes(StandardCharsets.US_ASCII);
		byte[] actual = state.fingerprint().getBytes(StandardCharsets.US_ASCII);
		return MessageDigest.isEqual(expected, actual);
	}

	String fingerprint(SessionState state) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(key);
			byte[] tag = mac.doFinal(canonicalJson(state).getBytes(StandardCharsets.UTF_8));
			return Base64.getUrlEncoder().withoutPadding().encodeToString(tag);
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException("HmacSHA256 is not available", e);
		}
	}

	String canonicalJson(SessionState state) {
		ObjectNode json = mapper.createObjectNode();
		json.set("parameters", parametersToJson(state.parameters()));
		ArrayNode turns = json.putArray("turns");
		for (Turn turn : state.log().turns()) {
			turns.add(turnToJson(turn));
		}
		if (state.latestResult() != null) {
			json.set("latestResult", resultToJson(state.latestResult()));
		}
		json.put("contextSummary", state.contextSummary());
		try {
			return mapper.writeValueAsString(json);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render session state", e);
		}
	}

	private ObjectNode turnToJson(Turn turn) {
		ObjectNode json = mapper.createObjectNode();
		json.put("sequence", turn.sequence());
		json.put("userText", turn.userText());
		json.put("responseText", turn.responseText());
		json.put("timestamp", turn.timestamp().toString());
		json.put("kind", turn.kind().name());
		json.put("outcome", turn.outcome().name());
		if (turn.simulationResult() != null) {
			json.set("simulationResult", resultToJson(turn.simulationResult()));
		}
		ArrayNode changes = json.putArray("parameterChanges");
		for (ParameterChange change : turn.parameterChanges()) {
			ObjectNode node = changes.addObject();
			node.put("name", change.name());
			putValue(node, "old", change.oldValue());
			putValue(node, "new", change.newValue());
		}
		return json;
	}

	private ObjectNode resultToJson(SimulationResult result) {
		ObjectNode json = mapper.createObjectNode();
		json.set("parameters", parametersToJson(result.parameters()));
		ArrayNode curve = json.putArray("curve");
		for (CurvePoint point : result.curve()) {
			curve.addArray().add(point.powerMw()).add(point.voltagePu());
		}
		json.put("criticalVoltage", result.criticalVoltage());
		json.put("maxPower", result.maxPower());
		json.put("timestamp", result.timestamp().toString());
		return json;
	}

	private ObjectNode parametersToJson(ParameterSet parameters) {
		ObjectNode json = mapper.createObjectNode();
		for (Map.Entry<String, Object> entry : parameters.asMap().entrySet()) {
			putValue(json, entry.getKey(), entry.getValue());
		}
		return json;
	}

	private static void putValue(ObjectNode node, String field, Object value) {
		if (value == null) {
			node.putNull(field);
		}
		else if (value instanceof Integer i) {
			node.put(field, i);
		}
		else if (value instanceof Double d) {
			node.put(field, d);
		}
		else if (value instanceof Boolean b) {
			node.put(field, b);
		}
		else {
			node.put(field, value.toString());
		}
	}

	private static byte[] randomKey() {
		byte[] secret = new byte[KEY_LENGTH];
		new SecureRandom().nextBytes(secret);
		return secret;
	}
}
