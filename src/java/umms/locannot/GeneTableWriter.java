package umms.locannot;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import umms.core.annotation.TSSRegion;

/**
 * Writes annotations as a tab separated table, one row per location and a block of four
 * columns per closest-gene slot. Rows with fewer closest genes than slots are padded with n/a.
 */
public class GeneTableWriter {

	private final BufferedWriter bw;
	private final TSSRegion tssRegion;
	private final int closestN;

	public GeneTableWriter(Writer writer, TSSRegion tssRegion, int closestN) {
		this.bw = writer instanceof BufferedWriter ? (BufferedWriter) writer : new BufferedWriter(writer);
		this.tssRegion = tssRegion;
		this.closestN = closestN;
	}

	public List<String> getHeaders() {
		String prom = "(prom=-" + (tssRegion.getOffset5p() / 1000) + "/+" + (tssRegion.getOffset3p() / 1000) + "kb)";
		List<String> headers = new ArrayList<String>(5 + 4 * closestN);
		headers.add("Location");
		headers.add("ID");
		headers.add("Gene Symbol");
		headers.add("Relative To Gene " + prom);
		headers.add("TSS Distance");
		for (int i = 1; i <= closestN; i++) {
			headers.add("#" + i + " Closest ID");
			headers.add("#" + i + " Closest Gene Symbols");
			headers.add("#" + i + " Relative To Closet Gene " + prom);
			headers.add("#" + i + " TSS Closest Distance");
		}
		return headers;
	}

	public void writeHeader() throws IOException {
		writeRow(getHeaders());
	}

	public void write(GeneAnnotation annotation) throws IOException {
		List<String> row = new ArrayList<String>(5 + 4 * closestN);
		row.add(annotation.getLocation().toString());
		row.add(annotation.getGeneIdsString());
		row.add(annotation.getGeneSymbolsString());
		row.add(annotation.getLabelsString());
		row.add(annotation.getTssDistancesString());
		List<ClosestGene> closest = annotation.getClosestGenes();
		for (int i = 0; i < closestN; i++) {
			if (i < closest.size()) {
				ClosestGene gene = closest.get(i);
				row.add(gene.getGeneId());
				row.add(gene.getGeneSymbol());
				row.add(gene.getLabel());
				row.add(Integer.toString(gene.getTssDistance()));
			} else {
				for (int j = 0; j < 4; j++) {
					row.add(Classification.NA);
				}
			}
		}
		writeRow(row);
	}

	private void writeRow(List<String> row) throws IOException {
		bw.write(StringUtils.join(row, "\t"));
		bw.newLine();
	}

	public void flush() throws IOException {
		bw.flush();
	}
}
