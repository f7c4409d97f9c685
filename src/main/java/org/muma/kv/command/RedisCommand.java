package org.muma.kv.command;

import org.muma.kv.common.RedisZSet;
import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.protocol.BulkString;
import org.muma.kv.protocol.ErrorMessage;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisInteger;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.protocol.SimpleString;
import org.muma.kv.store.StorageEngine;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * One wire command. Implementations validate arity and argument types, build the option object,
 * call the engine and shape the reply. Engine errors propagate to the dispatcher unless the
 * command has a reply value for them.
 */
public interface RedisCommand {

    /**
     * @param args the full request, element 0 is the command name
     */
    RedisMessage execute(StorageEngine storage, RedisArray args);

    // --- argument helpers ---

    /**
     * Keys, members and patterns keep their exact bytes, one char per byte.
     */
    default String argString(RedisMessage[] elements, int index) {
        RedisMessage msg = elements[index];
        if (msg instanceof BulkString b && !b.isNull()) return b.asBinaryString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof RedisInteger i) return String.valueOf(i.value());
        throw new InvalidArgumentException("Protocol error: expected bulk string argument");
    }

    default byte[] argBytes(RedisMessage[] elements, int index) {
        RedisMessage msg = elements[index];
        if (msg instanceof BulkString b && !b.isNull()) return b.content();
        return argString(elements, index).getBytes(StandardCharsets.ISO_8859_1);
    }

    default String argUpper(RedisMessage[] elements, int index) {
        return argString(elements, index).toUpperCase(Locale.ROOT);
    }

    default long parseLong(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw InvalidArgumentException.notAnInteger();
        }
    }

    default double parseScore(String s) {
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "inf", "+inf" -> Double.POSITIVE_INFINITY;
            case "-inf" -> Double.NEGATIVE_INFINITY;
            default -> {
                double v;
                try {
                    v = Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    throw InvalidArgumentException.notAFloat();
                }
                if (Double.isNaN(v)) throw InvalidArgumentException.notAFloat();
                yield v;
            }
        };
    }

    // --- reply helpers ---

    /**
     * Scores the way Redis prints them: 1, 1.5, inf, -inf.
     */
    default String formatScore(double s) {
        if (Double.isInfinite(s)) {
            return s > 0 ? "inf" : "-inf";
        }
        if (s == Math.rint(s) && Math.abs(s) < 1e17) {
            return String.valueOf((long) s);
        }
        return BigDecimal.valueOf(s).stripTrailingZeros().toPlainString();
    }

    default RedisMessage buildZSetResponse(List<RedisZSet.ZSetEntry> list, boolean withScores) {
        int size = list.size() * (withScores ? 2 : 1);
        RedisMessage[] result = new RedisMessage[size];
        int i = 0;
        for (RedisZSet.ZSetEntry entry : list) {
            result[i++] = BulkString.ofBinary(entry.member());
            if (withScores) {
                result[i++] = new BulkString(formatScore(entry.score()));
            }
        }
        return new RedisArray(result);
    }

    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }
}
