package shaderir.glsl;

import com.google.common.base.Preconditions;

/**
 * The local index counter of one function. Parameters, block locals and loop
 * counters all draw from it, so every {@code l<i>} is unique in its function.
 */
final class LocalNames {

    private int next = 0;

    /**
     * @return the name of a freshly allocated local
     */
    String allocate() {
        return name(next++);
    }

    String reference(int index) {
        Preconditions.checkElementIndex(index, next, "local variable");
        return name(index);
    }

    int allocated() {
        return next;
    }

    static String name(int index) {
        return "l" + index;
    }
}
