package umms.locannot;

import java.io.StringWriter;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import junit.framework.TestCase;
import umms.core.annotation.Location;
import umms.core.annotation.TSSRegion;

public class GeneAnnotationJsonWriterTest extends TestCase {

	public void testWritesOneObjectPerLocation() throws Exception {
		Annotator annotator = new Annotator(GeneFixtures.store(), new TSSRegion(2000, 1000), 3);
		StringWriter out = new StringWriter();
		GeneAnnotationJsonWriter writer = new GeneAnnotationJsonWriter(out);
		writer.write(annotator.annotate(GeneFixtures.QUERY));
		writer.write(annotator.annotate(new Location("chr3", 10, 20)));
		writer.finish();

		JsonArray array = JsonParser.parseString(out.toString()).getAsJsonArray();
		assertEquals(2, array.size());

		JsonObject first = array.get(0).getAsJsonObject();
		assertEquals("chr3:187745448-187745468", first.get("location").getAsString());
		assertEquals("GENE1", first.getAsJsonArray("gene_ids").get(0).getAsString());
		assertEquals("promoter,intronic", first.getAsJsonArray("prom_labels").get(0).getAsString());
		JsonObject closest = first.getAsJsonArray("closest_genes").get(2).getAsJsonObject();
		assertEquals("GENE3", closest.get("gene_id").getAsString());
		assertEquals("intergenic", closest.get("prom_label").getAsString());
		assertEquals(54542, closest.get("tss_dist").getAsInt());

		JsonObject second = array.get(1).getAsJsonObject();
		assertEquals("n/a", second.getAsJsonArray("gene_ids").get(0).getAsString());
	}

	public void testEmptyArray() throws Exception {
		StringWriter out = new StringWriter();
		new GeneAnnotationJsonWriter(out).finish();
		assertEquals(0, JsonParser.parseString(out.toString()).getAsJsonArray().size());
	}
}
