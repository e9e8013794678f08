package org.declhoist.host;

import org.codehaus.groovy.runtime.callsite.CallSite;
import org.codehaus.groovy.runtime.callsite.CallSiteArray;
import org.codehaus.groovy.runtime.typehandling.DefaultTypeTransformation;
import org.declhoist.Undefined;

/**
 * {@link Invoker} that goes through the Groovy runtime.
 *
 * <p>
 * A function is anything Groovy can {@code call(...)}: a {@link groovy.lang.Closure}, a method closure,
 * or any object with a suitable {@code call} method.
 * Conditions follow Groovy truth, except that {@link Undefined} is false.
 */
public class DefaultInvoker implements Invoker {
    public Object call(Object function, Object[] args) throws Throwable {
        if (function == null || function == Undefined.INSTANCE)
            throw new IllegalArgumentException("Cannot call " + (function == null ? "null" : function));
        CallSite callSite = fakeCallSite("call");
        return callSite.call(function, args);
    }

    public boolean isTrue(Object value) {
        if (value == Undefined.INSTANCE) return false;
        return DefaultTypeTransformation.castToBoolean(value);
    }

    protected CallSite fakeCallSite(String method) {
        CallSiteArray csa = new CallSiteArray(DefaultInvoker.class, new String[] {method});
        return csa.array[0];
    }

    private static final long serialVersionUID = 1L;
}
