package umms.locannot;

import java.io.IOException;
import java.io.Writer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.stream.JsonWriter;

/**
 * Writes annotations as a JSON array, one object per location.
 */
public class GeneAnnotationJsonWriter {

	private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

	private final JsonWriter jw;

	public GeneAnnotationJsonWriter(Writer writer) throws IOException {
		this.jw = gson.newJsonWriter(writer);
		jw.beginArray();
	}

	public void write(GeneAnnotation annotation) throws IOException {
		gson.toJson(toJson(annotation), jw);
	}

	/**
	 * Ends the array and flushes; the underlying writer stays open.
	 */
	public void finish() throws IOException {
		jw.endArray();
		jw.flush();
	}

	static JsonObject toJson(GeneAnnotation annotation) {
		JsonObject obj = new JsonObject();
		obj.addProperty("location", annotation.getLocation().toString());
		obj.add("gene_ids", gson.toJsonTree(annotation.getGeneIds()));
		obj.add("gene_symbols", gson.toJsonTree(annotation.getGeneSymbols()));
		obj.add("prom_labels", gson.toJsonTree(annotation.getLabels()));
		obj.add("tss_dists", gson.toJsonTree(annotation.getTssDistances()));
		JsonArray closest = new JsonArray();
		for (ClosestGene gene : annotation.getClosestGenes()) {
			JsonObject c = new JsonObject();
			c.addProperty("gene_id", gene.getGeneId());
			c.addProperty("gene_symbol", gene.getGeneSymbol());
			c.addProperty("prom_label", gene.getLabel());
			c.addProperty("tss_dist", gene.getTssDistance());
			closest.add(c);
		}
		obj.add("closest_genes", closest);
		return obj;
	}
}
