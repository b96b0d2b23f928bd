package org.learningjava.blockprog.domain.service.assembly;

/**
 * Element and attribute names of the block editor export format (local names).
 */
public final class BlockXmlNames {

    public static final String ROOT = "xml";
    public static final String BLOCK = "block";
    public static final String STATEMENT = "statement";
    public static final String FIELD = "field";
    public static final String NEXT = "next";
    public static final String VARIABLES = "variables";

    public static final String ATTR_TYPE = "type";
    public static final String ATTR_ID = "id";
    public static final String ATTR_NAME = "name";

    private BlockXmlNames() {
    }
}
