/*
 * @LICENSE@
 */

package org.subrx.regex;

import java.util.ArrayList;
import java.util.List;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /*
     * "{1,3,4}" for the set entries of a boolean row, skipping index 0
     */
    static String indicesFrom(boolean[] row) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < row.length; ++i) {
            if (row[i]) {
                sb.append(i).append(',');
            }
        }
        if (sb.length() == 0)
            return "{}";
        sb.insert(0, '{');
        sb.setCharAt(sb.length() - 1, '}');
        return sb.toString();
    }

    static boolean[][] copyOf(boolean[][] table) {
        boolean[][] ret = new boolean[table.length][];
        for (int i = 0; i < table.length; ++i) {
            ret[i] = table[i].clone();
        }
        return ret;
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        };

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            }
        }

        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.length() == 0 ? "none" : sb.toString();
        }
    };

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    /*
     * printable form of a single input char for error messages
     */
    static String esc(char c) {
        if (c < 32 || 126 < c) {
            StringBuilder sb = new StringBuilder(Integer.toHexString(c));
            while (sb.length() < 4) {
                sb.insert(0, '0');
            }
            return sb.insert(0, "\\u").toString();
        }
        return c == '\'' ? "\\'" : String.valueOf(c);
    }
}
