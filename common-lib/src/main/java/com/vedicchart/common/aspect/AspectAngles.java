package com.vedicchart.common.aspect;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.model.BodyPosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Effective special-aspect angles of a body at chart time.
 *
 * <ol>
 *   <li>start from the body's base angle set</li>
 *   <li>if retrograde, substitute each angle once through the body's swap table
 *       (Mars 90→270, 210→150; Saturn 60→300, 270→90; 180 is never swapped)</li>
 *   <li>for Rahu and Ketu, append 30° when the body's own sign index is odd
 *       (Taurus, Cancer...), else 330°</li>
 * </ol>
 * The swap is applied to the base set only, so it can never run twice.
 */
public final class AspectAngles {

    public static final int NODE_EXTRA_ODD_INDEX = 30;
    public static final int NODE_EXTRA_EVEN_INDEX = 330;

    private AspectAngles() {}

    public static List<Integer> effective(BodyPosition position) {
        return effective(position.body(), position.sign(), position.retrograde());
    }

    public static List<Integer> effective(Body body, Sign ownSign, boolean retrograde) {
        List<Integer> angles = new ArrayList<>(body.baseAspectAngles().size() + 1);
        Map<Integer, Integer> swaps = body.retrogradeAngleSwaps();
        for (Integer angle : body.baseAspectAngles()) {
            angles.add(retrograde ? swaps.getOrDefault(angle, angle) : angle);
        }
        if (body.isNode()) {
            angles.add(ownSign.index() % 2 == 1 ? NODE_EXTRA_ODD_INDEX : NODE_EXTRA_EVEN_INDEX);
        }
        return Collections.unmodifiableList(angles);
    }

    /** Whole signs counted forward for an angle: {@code angle / 30}. */
    public static int signOffset(int angle) {
        return angle / 30;
    }

    /**
     * Traditional ordinal name, e.g. 180 → "7th Aspect", 30 → "2nd Aspect".
     * Display only; no computation depends on it.
     */
    public static String displayName(int angle) {
        if (angle % 30 != 0) {
            return angle + "° Aspect";
        }
        int ordinal = signOffset(angle) + 1;
        return ordinal + ordinalSuffix(ordinal) + " Aspect";
    }

    private static String ordinalSuffix(int n) {
        if (n >= 11 && n <= 13) {
            return "th";
        }
        return switch (n % 10) {
            case 1 -> "st";
            case 2 -> "nd";
            case 3 -> "rd";
            default -> "th";
        };
    }
}
