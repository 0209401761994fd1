package de.mirkosertic.docconsolidator.table;

import de.mirkosertic.docconsolidator.registry.Entity;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The entity table: read in full, mutated in memory and written back in full.
 * <p>
 * Saving reopens the file and only rewrites the derived columns of the rows that
 * were read, so additional columns and formatting survive a run.
 */
public final class EntityTable {

    private static final Logger logger = LoggerFactory.getLogger(EntityTable.class);

    private final Path file;
    private final List<Entity> entities;
    private final List<TableFormatException> formatProblems;

    private EntityTable(final Path file, final List<Entity> entities, final List<TableFormatException> formatProblems) {
        this.file = file;
        this.entities = entities;
        this.formatProblems = formatProblems;
    }

    /**
     * @throws IOException if the file cannot be read as a workbook
     */
    public static EntityTable load(final Path file) throws IOException {
        final List<Entity> entities = new ArrayList<>();
        final List<TableFormatException> problems = new ArrayList<>();

        try (final Workbook workbook = Workbooks.open(file)) {
            final Sheet sheet = Workbooks.firstSheet(workbook);
            final EntityTableSchema schema = EntityTableSchema.resolve(Workbooks.headerRow(sheet));
            problems.addAll(schema.headerProblems());

            if (schema.usable()) {
                for (int rowNumber = 1; rowNumber <= sheet.getLastRowNum(); rowNumber++) {
                    final Row row = sheet.getRow(rowNumber);
                    if (Workbooks.isBlank(row)) {
                        continue;
                    }
                    entities.add(schema.read(row, problems::add));
                }
            }
        }

        logger.info("Loaded {} entities from {}", entities.size(), file);
        return new EntityTable(file, entities, problems);
    }

    /**
     * Create an empty table carrying only the expected headers.
     */
    public static void createTemplate(final Path file) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final XSSFWorkbook workbook = new XSSFWorkbook()) {
            final Sheet sheet = workbook.createSheet();
            final Row header = sheet.createRow(0);
            for (int i = 0; i < EntityTableSchema.HEADERS.size(); i++) {
                header.createCell(i).setCellValue(EntityTableSchema.HEADERS.get(i));
            }
            Workbooks.save(workbook, file);
        }
        logger.info("Created entity table template: {}", file);
    }

    public void save() throws IOException {
        try (final Workbook workbook = Workbooks.open(file)) {
            final Sheet sheet = Workbooks.firstSheet(workbook);
            final EntityTableSchema schema = EntityTableSchema.resolve(Workbooks.headerRow(sheet));
            for (final Entity entity : entities) {
                Row row = sheet.getRow(entity.rowNumber());
                if (row == null) {
                    row = sheet.createRow(entity.rowNumber());
                }
                schema.write(row, entity);
            }
            Workbooks.save(workbook, file);
        }
        logger.info("Saved {} entities to {}", entities.size(), file);
    }

    public Path file() {
        return file;
    }

    public List<Entity> entities() {
        return entities;
    }

    public List<TableFormatException> formatProblems() {
        return List.copyOf(formatProblems);
    }
}
