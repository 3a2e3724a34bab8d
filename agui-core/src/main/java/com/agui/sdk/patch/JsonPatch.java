/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.patch;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.agui.sdk.error.AgUiPatchException;
import com.agui.sdk.spec.AgUiSchema.JsonPatchOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RFC 6902 JSON Patch over plain JSON trees ({@code Map}, {@code List} and scalars).
 *
 * <p>
 * Paths are RFC 6901 JSON Pointers: {@code ""} is the whole document, reference tokens
 * are separated by {@code /}, {@code ~1} stands for {@code /} and {@code ~0} for
 * {@code ~}. In an array, {@code -} refers to the position after the last element.
 *
 * <p>
 * Documents are never modified in place; a patched deep copy is returned.
 * {@link #apply(Object, List)} is fail-soft: an operation that cannot be applied is
 * skipped and the remaining operations still run, except that a failed {@code test}
 * discards the whole patch. {@link #applyStrict(Object, List)} is atomic.
 */
public final class JsonPatch {

	private static final Logger logger = LoggerFactory.getLogger(JsonPatch.class);

	private static final Object MISSING = new Object();

	private JsonPatch() {
	}

	/**
	 * Applies a patch, skipping operations whose path does not resolve.
	 * @param document the document to patch, left untouched
	 * @param operations the operations to apply in order
	 * @return the patched copy, or the original document if a {@code test} failed
	 */
	public static Object apply(Object document, List<JsonPatchOperation> operations) {
		if (operations == null || operations.isEmpty()) {
			return document;
		}
		Object[] root = { deepCopy(document) };
		for (JsonPatchOperation operation : operations) {
			Failure failure = applyOperation(root, operation);
			if (failure == null) {
				continue;
			}
			if (failure.discardsPatch()) {
				logger.debug("Discarding JSON Patch: {} ({})", failure.reason(), operation);
				return document;
			}
			logger.debug("Skipping JSON Patch operation: {} ({})", failure.reason(), operation);
		}
		return root[0];
	}

	/**
	 * Applies a patch atomically.
	 * @param document the document to patch, left untouched
	 * @param operations the operations to apply in order
	 * @return the patched copy
	 * @throws AgUiPatchException if any operation cannot be applied
	 */
	public static Object applyStrict(Object document, List<JsonPatchOperation> operations) {
		if (operations == null || operations.isEmpty()) {
			return document;
		}
		Object[] root = { deepCopy(document) };
		for (JsonPatchOperation operation : operations) {
			Failure failure = applyOperation(root, operation);
			if (failure != null) {
				throw new AgUiPatchException(failure.reason(), operation);
			}
		}
		return root[0];
	}

	/**
	 * Reads the value a JSON Pointer refers to.
	 * @param document the document to read
	 * @param pointer an RFC 6901 JSON Pointer
	 * @return the value, or {@code null} if the pointer does not resolve
	 */
	public static Object get(Object document, String pointer) {
		List<String> tokens = parsePointer(pointer);
		if (tokens == null) {
			return null;
		}
		Object value = resolve(document, tokens);
		return value == MISSING ? null : value;
	}

	/**
	 * Splits a JSON Pointer into unescaped reference tokens.
	 * @return the tokens, or {@code null} if the pointer is malformed
	 */
	static List<String> parsePointer(String pointer) {
		if (pointer == null) {
			return null;
		}
		if (pointer.isEmpty()) {
			return List.of();
		}
		if (pointer.charAt(0) != '/') {
			return null;
		}
		List<String> tokens = new ArrayList<>();
		for (String raw : pointer.substring(1).split("/", -1)) {
			tokens.add(raw.replace("~1", "/").replace("~0", "~"));
		}
		return tokens;
	}

	private static Failure applyOperation(Object[] root, JsonPatchOperation operation) {
		if (operation == null || operation.op() == null) {
			return Failure.skip("missing op");
		}
		List<String> path = parsePointer(operation.path());
		if (path == null) {
			return Failure.skip("malformed path '" + operation.path() + "'");
		}
		switch (operation.op()) {
			case "add":
				return add(root, path, deepCopy(operation.value()));
			case "remove":
				return remove(root, path);
			case "replace":
				return replace(root, path, deepCopy(operation.value()));
			case "move":
				return move(root, operation.from(), path);
			case "copy": {
				List<String> from = parsePointer(operation.from());
				if (from == null) {
					return Failure.skip("malformed from '" + operation.from() + "'");
				}
				Object value = resolve(root[0], from);
				if (value == MISSING) {
					return Failure.skip("from path does not exist");
				}
				return add(root, path, deepCopy(value));
			}
			case "test": {
				Object actual = resolve(root[0], path);
				if (actual == MISSING || !jsonEquals(actual, operation.value())) {
					return Failure.discard("test failed at '" + operation.path() + "'");
				}
				return null;
			}
			default:
				return Failure.skip("unsupported op '" + operation.op() + "'");
		}
	}

	@SuppressWarnings("unchecked")
	private static Failure add(Object[] root, List<String> path, Object value) {
		if (path.isEmpty()) {
			root[0] = value;
			return null;
		}
		Object parent = resolve(root[0], path.subList(0, path.size() - 1));
		String token = path.get(path.size() - 1);
		if (parent instanceof Map) {
			((Map<String, Object>) parent).put(token, value);
			return null;
		}
		if (parent instanceof List) {
			List<Object> list = (List<Object>) parent;
			if ("-".equals(token)) {
				list.add(value);
				return null;
			}
			int index = arrayIndex(token);
			if (index < 0 || index > list.size()) {
				return Failure.skip("array index '" + token + "' out of bounds");
			}
			list.add(index, value);
			return null;
		}
		return Failure.skip("parent path does not exist");
	}

	@SuppressWarnings("unchecked")
	private static Failure remove(Object[] root, List<String> path) {
		if (path.isEmpty()) {
			return Failure.skip("cannot remove the document root");
		}
		Object parent = resolve(root[0], path.subList(0, path.size() - 1));
		String token = path.get(path.size() - 1);
		if (parent instanceof Map) {
			Map<String, Object> map = (Map<String, Object>) parent;
			if (!map.containsKey(token)) {
				return Failure.skip("path does not exist");
			}
			map.remove(token);
			return null;
		}
		if (parent instanceof List) {
			List<Object> list = (List<Object>) parent;
			int index = arrayIndex(token);
			if (index < 0 || index >= list.size()) {
				return Failure.skip("array index '" + token + "' out of bounds");
			}
			list.remove(index);
			return null;
		}
		return Failure.skip("path does not exist");
	}

	@SuppressWarnings("unchecked")
	private static Failure replace(Object[] root, List<String> path, Object value) {
		if (path.isEmpty()) {
			root[0] = value;
			return null;
		}
		Object parent = resolve(root[0], path.subList(0, path.size() - 1));
		String token = path.get(path.size() - 1);
		if (parent instanceof Map) {
			Map<String, Object> map = (Map<String, Object>) parent;
			if (!map.containsKey(token)) {
				return Failure.skip("path does not exist");
			}
			map.put(token, value);
			return null;
		}
		if (parent instanceof List) {
			List<Object> list = (List<Object>) parent;
			int index = arrayIndex(token);
			if (index < 0 || index >= list.size()) {
				return Failure.skip("array index '" + token + "' out of bounds");
			}
			list.set(index, value);
			return null;
		}
		return Failure.skip("path does not exist");
	}

	private static Failure move(Object[] root, String fromPointer, List<String> path) {
		List<String> from = parsePointer(fromPointer);
		if (from == null) {
			return Failure.skip("malformed from '" + fromPointer + "'");
		}
		Object value = resolve(root[0], from);
		if (value == MISSING) {
			return Failure.skip("from path does not exist");
		}
		if (from.equals(path)) {
			return null;
		}
		if (path.size() > from.size() && path.subList(0, from.size()).equals(from)) {
			return Failure.skip("cannot move a value into itself");
		}
		// remove and add must succeed together
		Object[] trial = { deepCopy(root[0]) };
		Failure failure = remove(trial, from);
		if (failure == null) {
			failure = add(trial, path, value);
		}
		if (failure == null) {
			root[0] = trial[0];
		}
		return failure;
	}

	private static Object resolve(Object document, List<String> tokens) {
		Object current = document;
		for (String token : tokens) {
			if (current instanceof Map) {
				Map<?, ?> map = (Map<?, ?>) current;
				if (!map.containsKey(token)) {
					return MISSING;
				}
				current = map.get(token);
			}
			else if (current instanceof List) {
				List<?> list = (List<?>) current;
				int index = arrayIndex(token);
				if (index < 0 || index >= list.size()) {
					return MISSING;
				}
				current = list.get(index);
			}
			else {
				return MISSING;
			}
		}
		return current;
	}

	private static int arrayIndex(String token) {
		if (token.isEmpty() || token.length() > 9 || (token.length() > 1 && token.charAt(0) == '0')) {
			return -1;
		}
		for (int i = 0; i < token.length(); i++) {
			if (!Character.isDigit(token.charAt(i))) {
				return -1;
			}
		}
		return Integer.parseInt(token);
	}

	/**
	 * Copies the containers of a JSON tree into mutable ones. Scalars are shared.
	 */
	static Object deepCopy(Object value) {
		if (value instanceof Map) {
			Map<String, Object> copy = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
			}
			return copy;
		}
		if (value instanceof List) {
			List<Object> copy = new ArrayList<>();
			for (Object element : (List<?>) value) {
				copy.add(deepCopy(element));
			}
			return copy;
		}
		return value;
	}

	private static boolean isFinite(Number number) {
		if (number instanceof Double || number instanceof Float) {
			return Double.isFinite(number.doubleValue());
		}
		return true;
	}

	private static boolean jsonEquals(Object left, Object right) {
		if (left instanceof Number && right instanceof Number) {
			if (!isFinite((Number) left) || !isFinite((Number) right)) {
				return Objects.equals(left, right);
			}
			return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString())) == 0;
		}
		if (left instanceof Map && right instanceof Map) {
			Map<?, ?> l = (Map<?, ?>) left;
			Map<?, ?> r = (Map<?, ?>) right;
			if (l.size() != r.size()) {
				return false;
			}
			for (Map.Entry<?, ?> entry : l.entrySet()) {
				if (!r.containsKey(entry.getKey()) || !jsonEquals(entry.getValue(), r.get(entry.getKey()))) {
					return false;
				}
			}
			return true;
		}
		if (left instanceof List && right instanceof List) {
			List<?> l = (List<?>) left;
			List<?> r = (List<?>) right;
			if (l.size() != r.size()) {
				return false;
			}
			Iterator<?> li = l.iterator();
			Iterator<?> ri = r.iterator();
			while (li.hasNext()) {
				if (!jsonEquals(li.next(), ri.next())) {
					return false;
				}
			}
			return true;
		}
		return Objects.equals(left, right);
	}

	private record Failure(String reason, boolean discardsPatch) {

		static Failure skip(String reason) {
			return new Failure(reason, false);
		}

		static Failure discard(String reason) {
			return new Failure(reason, true);
		}

	}

}
