package org.declhoist.host;

import com.google.common.collect.Maps;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.declhoist.Undefined;

/**
 * {@link Env} for a new block.
 */
public class BlockScopeEnv extends ProxyEnv {
    /** Lazily declared using {@link Collections#emptyMap()} until we declare variables, then converted to a (small) {@link HashMap} */
    private Map<String, Object> locals;

    public BlockScopeEnv(Env parent) {
        this(parent, 0);
    }

    public BlockScopeEnv(Env parent, int localsSize) {
        super(parent);
        if (localsSize <= 0) {
            locals = Collections.emptyMap();
        } else {
            locals = Maps.newHashMapWithExpectedSize(localsSize);
        }
    }

    @Override
    public void declareVariable(String name) {
        if (!(locals instanceof HashMap)) {
            this.locals = new HashMap<>(2);
        }
        locals.put(name, Undefined.INSTANCE);
    }

    @Override
    public Object getLocalVariable(String name) throws UnboundVariableException {
        if (locals.containsKey(name)) return locals.get(name);
        else return parent.getLocalVariable(name);
    }

    @Override
    public void setLocalVariable(String name, Object value) throws UnboundVariableException {
        if (locals.containsKey(name)) locals.put(name, value);
        else parent.setLocalVariable(name, value);
    }

    private static final long serialVersionUID = 1L;
}
