package org.declhoist;

import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.Test;

public class UndefinedTest {
    /**
     * Identity comparisons against {@link Undefined#INSTANCE} must keep working after a round trip.
     */
    @Test
    public void staysSingletonAcrossSerialization() throws Exception {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ObjectOutputStream oos = new ObjectOutputStream(baos)) {
            oos.writeObject(Undefined.INSTANCE);
        }
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(baos.toByteArray()))) {
            assertThat(ois.readObject(), sameInstance((Object) Undefined.INSTANCE));
        }
    }
}
