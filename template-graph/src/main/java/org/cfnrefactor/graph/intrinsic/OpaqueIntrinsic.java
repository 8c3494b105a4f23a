package org.cfnrefactor.graph.intrinsic;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Any other intrinsic (Fn::If, Fn::Select, ...). The payload is carried as-is; traversals descend into it.
 */
public record OpaqueIntrinsic(String functionName, JsonNode payload) implements Intrinsic {

    @Override
    public JsonNode toNode() {
        return Intrinsic.wrap(functionName, payload);
    }
}
