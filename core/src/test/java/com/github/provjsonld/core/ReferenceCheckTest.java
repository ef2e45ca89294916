package com.github.provjsonld.core;

import static com.github.provjsonld.core.TestUtils.fixture;
import static com.github.provjsonld.core.TestUtils.json;

import org.junit.Assert;
import org.junit.Test;

import com.github.provjsonld.core.ProvJsonLdError.Error;

public class ReferenceCheckTest {

    private static final ProvJsonLdOptions CHECKED = new ProvJsonLdOptions()
            .setCheckReferences(true);

    @Test
    public void offByDefault() throws Exception {
        Assert.assertFalse(ProvJsonLdProcessor.convert(fixture("workflow.json")).hasWarnings());
    }

    @Test
    public void reportsRolesNamingNoNode() throws Exception {
        final ConversionResult result = ProvJsonLdProcessor.convert(fixture("workflow.json"),
                CHECKED);

        // lab:bob is only referenced, never declared
        Assert.assertEquals(1, result.getWarnings().size());
        final ConversionWarning warning = result.getWarnings().get(0);
        Assert.assertEquals(Error.DANGLING_REFERENCE, warning.getType());
        Assert.assertEquals("_:attr2", warning.getPath().getIdentifier());
        Assert.assertEquals("agent", warning.getPath().getField());
        Assert.assertEquals("[ex:provenanceOfReport]", warning.getPath().getBundles().toString());
    }

    @Test
    public void enclosingScopesAreVisible() throws Exception {
        final ConversionResult result = ProvJsonLdProcessor.convert(json("{"
                + "'prefix':{'ex':'http://example.org/'},"
                + "'agent':{'ex:ag':{}},"
                + "'bundle':{'ex:b':{'entity':{'ex:e':{}},"
                + "'wasAttributedTo':{'_:a':{'prov:entity':'ex:e','prov:agent':'ex:ag'}}}}}"),
                CHECKED);

        Assert.assertFalse(result.hasWarnings());
    }

    @Test
    public void bundlesAreKnownNodes() throws Exception {
        final ConversionResult result = ProvJsonLdProcessor.convert(json("{"
                + "'prefix':{'ex':'http://example.org/'},"
                + "'agent':{'ex:ag':{}},"
                + "'wasAttributedTo':{'_:a':{'prov:entity':'ex:b1','prov:agent':'ex:ag'}},"
                + "'bundle':{'ex:b1':{},"
                + "'ex:b2':{'wasDerivedFrom':{'_:d':{'prov:generatedEntity':'ex:b2',"
                + "'prov:usedEntity':'ex:b1'}}}}}"), CHECKED);

        Assert.assertFalse(result.hasWarnings());
    }

    @Test
    public void neverFatal() throws Exception {
        final ConversionResult result = ProvJsonLdProcessor.convert(json("{"
                + "'prefix':{'ex':'http://example.org/'},"
                + "'used':{'_:u':{'prov:activity':'ex:a','prov:entity':'ex:e'}}}"),
                new ProvJsonLdOptions().setCheckReferences(true).setStrict(true));

        Assert.assertEquals(2, result.getWarnings().size());
        Assert.assertTrue(result.hasWarning(Error.DANGLING_REFERENCE));
    }
}
