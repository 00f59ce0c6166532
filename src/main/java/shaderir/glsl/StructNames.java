package shaderir.glsl;

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import shaderir.ir.Type;

/**
 * Assigns {@code S0, S1, ...} to struct types in order of first appearance.
 * Structurally equal types share a name. Definitions are kept in dependency
 * order: a member struct is always defined before the struct containing it.
 */
final class StructNames {

    private final Map<Type, String> names = Maps.newHashMap();
    private final List<Type> definitionOrder = Lists.newArrayList();

    /**
     * registers the type and all struct types nested in it
     */
    void register(Type type) {
        if (!type.isStruct() || names.containsKey(type)) {
            return;
        }
        names.put(type, "S" + names.size());
        for (Type member : type.getSub()) {
            register(member);
        }
        definitionOrder.add(type);
    }

    String nameOf(Type type) {
        String name = names.get(type);
        Preconditions.checkState(name != null, "struct type was not registered: %s", type);
        return name;
    }

    /**
     * @return the registered struct types, each after the structs it depends on
     */
    List<Type> getDefinitionOrder() {
        return ImmutableList.copyOf(definitionOrder);
    }

    int size() {
        return names.size();
    }

    static String memberName(int index) {
        return "M" + index;
    }
}
