import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.lumen.script.FormReader;
import com.lumen.script.Keyword;
import com.lumen.script.ReaderException;
import com.lumen.script.Symbol;
import com.lumen.script.Vec;

public class FormReaderTest {

    @Test
    void reads_scalars() {
        List<Object> forms = new FormReader("42 -7 1.5 \"hi\\n\" nil true false :kw foo ns/bar").readAll();

        assertEquals(10, forms.size());
        assertEquals(42L, forms.get(0));
        assertEquals(-7L, forms.get(1));
        assertEquals(1.5, (Double) forms.get(2), 0.0);
        assertEquals("hi\n", forms.get(3));
        assertNull(forms.get(4));
        assertEquals(Boolean.TRUE, forms.get(5));
        assertEquals(Boolean.FALSE, forms.get(6));
        assertEquals(new Keyword("kw"), forms.get(7));
        assertEquals(Symbol.of(null, "foo"), forms.get(8));
        assertEquals(Symbol.of("ns", "bar"), forms.get(9));
    }

    @Test
    void reads_nested_lists_vectors_and_quote() {
        FormReader r = new FormReader("(let [x 1] (+ x 'y))");
        Object form = r.read();

        assertTrue(form instanceof List);
        List<?> let = (List<?>) form;
        assertEquals(Symbol.of(null, "let"), let.get(0));
        assertTrue(let.get(1) instanceof Vec);
        assertEquals(2, ((Vec) let.get(1)).items.size());

        List<?> call = (List<?>) let.get(2);
        assertEquals(List.of(Symbol.of(null, "quote"), Symbol.of(null, "y")), call.get(2));
        assertSame(FormReader.EOF, r.read());
    }

    @Test
    void comments_and_commas_are_whitespace() {
        List<Object> forms = new FormReader("; leading\n1, 2 ; trailing\n,3").readAll();
        assertEquals(List.of(1L, 2L, 3L), forms);
    }

    @Test
    void forms_are_read_one_at_a_time() {
        FormReader r = new FormReader("1 (oops");
        assertEquals(1L, r.read());
        assertThrows(ReaderException.class, r::read);
    }

    @Test
    void errors_report_position_relative_to_start() {
        ReaderException e = assertThrows(ReaderException.class,
                () -> new FormReader("\n  )", 10, 1).read());
        assertEquals(11, e.line);
        assertTrue(e.getMessage().contains("Unmatched delimiter"));
    }

    @Test
    void unterminated_string_fails() {
        assertThrows(ReaderException.class, () -> new FormReader("\"abc").read());
    }
}
