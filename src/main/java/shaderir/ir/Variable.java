package shaderir.ir;

import com.google.common.base.Preconditions;

/**
 * Addresses a declaration by its zero-based position within its category.
 * For {@link VariableCategory#LOCAL} the position counts parameters, block
 * locals and loop counters of the enclosing function.
 */
public final class Variable {

	private final VariableCategory category;
	private final int index;

	public Variable(VariableCategory category, int index) {
		this.category = Preconditions.checkNotNull(category, "category");
		Preconditions.checkArgument(index >= 0, "negative variable index %s", index);
		this.index = index;
	}

	public VariableCategory getCategory() {
		return category;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Variable) {
			Variable variable = (Variable) obj;
			return category == variable.category && index == variable.index;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return category.hashCode() ^ index;
	}

	@Override
	public String toString() {
		return category + "#" + index;
	}
}
