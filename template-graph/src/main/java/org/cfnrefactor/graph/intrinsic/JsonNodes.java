package org.cfnrefactor.graph.intrinsic;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

final class JsonNodes {
    static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private JsonNodes() {}
}
