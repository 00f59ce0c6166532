package shaderir.ir;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public final class Type {

	private final BasicType main;
	private final ImmutableList<Type> sub;

	public Type(BasicType main, List<Type> sub) {
		this.main = Preconditions.checkNotNull(main, "main");
		this.sub = ImmutableList.copyOf(sub);
		Preconditions.checkArgument(main == BasicType.STRUCT || this.sub.isEmpty(),
				"Only struct types have members: %s", main);
	}

	public Type(BasicType main) {
		this(main, ImmutableList.of());
	}

	public BasicType getMain() {
		return main;
	}

	/**
	 * @return the member types of a struct, in declaration order
	 */
	public List<Type> getSub() {
		return sub;
	}

	public boolean isStruct() {
		return main == BasicType.STRUCT;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Type) {
			Type type = (Type) obj;
			return main == type.main && sub.equals(type.sub);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return main.hashCode() * 31 + sub.hashCode();
	}

	@Override
	public String toString() {
		if (!isStruct()) {
			return main.getGlslName();
		}
		StringBuilder result = new StringBuilder("struct{");
		boolean first = true;
		for (Type t : sub) {
			if (!first) {
				result.append(", ");
			}
			result.append(t);
			first = false;
		}
		result.append("}");
		return result.toString();
	}
}
