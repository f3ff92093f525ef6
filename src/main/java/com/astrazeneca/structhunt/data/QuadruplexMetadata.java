package com.astrazeneca.structhunt.data;

import java.util.Objects;

public class QuadruplexMetadata implements MotifMetadata {
    /**
     * Minimum run length of the pattern class that produced the match
     */
    public final int gRunLength;
    public final double gContent;
    public final double gcContent;

    public QuadruplexMetadata(int gRunLength, double gContent, double gcContent) {
        this.gRunLength = gRunLength;
        this.gContent = gContent;
        this.gcContent = gcContent;
    }

    @Override
    public Object[] columns() {
        return new Object[]{gRunLength, gContent, gcContent};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuadruplexMetadata that = (QuadruplexMetadata) o;
        return gRunLength == that.gRunLength &&
                Double.compare(that.gContent, gContent) == 0 &&
                Double.compare(that.gcContent, gcContent) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(gRunLength, gContent, gcContent);
    }

    @Override
    public String toString() {
        return "QuadruplexMetadata [gRunLength=" + gRunLength + ", gContent=" + gContent + ", gcContent=" + gcContent + "]";
    }
}
