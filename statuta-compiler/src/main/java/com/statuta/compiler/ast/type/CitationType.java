package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

import java.util.Objects;

/**
 * 法条引用 {@code Citation<"415", "1", "Penal Code">}
 */
public class CitationType extends TypeRef {
    private final String section;
    private final String subsection;
    private final String act;

    public CitationType(SourceLocation location, String section, String subsection, String act) {
        super(location);
        this.section = section;
        this.subsection = subsection;
        this.act = act;
    }

    public String getSection() {
        return section;
    }

    /** 子条款，可能为 null */
    public String getSubsection() {
        return subsection;
    }

    public String getAct() {
        return act;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitCitation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CitationType)) return false;
        CitationType that = (CitationType) o;
        return section.equals(that.section) && Objects.equals(subsection, that.subsection) && act.equals(that.act);
    }

    @Override
    public int hashCode() {
        return Objects.hash(section, subsection, act);
    }

    @Override
    public String toString() {
        return "Citation<s" + section + (subsection != null ? "(" + subsection + ")" : "") + " " + act + ">";
    }
}
